package work.mdwf.cli;

import picocli.CommandLine;

/**
 * Version line built from the command name and the jar's implementation version.
 */
final class VersionProvider implements CommandLine.IVersionProvider {
    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public String[] getVersion() {
        String implementationVersion = Main.class.getPackage().getImplementationVersion();
        String version = implementationVersion != null ? implementationVersion : "development";
        return new String[] { spec.name() + " (java) " + version };
    }
}
