package work.mdwf.security;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;
import work.mdwf.api.EnvironmentSecurityException;
import work.mdwf.api.ValidationException;

class SecurityValidatorTest {
    private final SecurityValidator validator = new SecurityValidator();

    @Test
    void rejectsTraversalAndAbsolutePaths() {
        assertThrows(EnvironmentSecurityException.class, () -> validator.validatePath("../evil.yml"));
        assertThrows(EnvironmentSecurityException.class, () -> validator.validatePath("workflows/../../evil.yml"));
        assertThrows(EnvironmentSecurityException.class, () -> validator.validatePath("/etc/passwd"));
        assertThrows(EnvironmentSecurityException.class, () -> validator.validatePath("\\\\server\\share"));
        assertThrows(EnvironmentSecurityException.class, () -> validator.validatePath("C:\\windows\\system.ini"));
        assertThrows(EnvironmentSecurityException.class, () -> validator.validatePath("a\0b.yml"));
        assertThrows(EnvironmentSecurityException.class, () -> validator.validatePath(" "));
    }

    @Test
    void enforcesPathDepth() {
        assertDoesNotThrow(() -> validator.validatePath("workflows/blog/templates/static/img/logo.png"));
        var error = assertThrows(
            EnvironmentSecurityException.class,
            () -> validator.validatePath("a/b/c/d/e/f/g.md")
        );
        assertTrue(error.getMessage().contains("too deep"));
    }

    @Test
    void rejectsUnsafeFilenames() {
        assertDoesNotThrow(() -> validator.validateFilename("default.md"));
        assertThrows(EnvironmentSecurityException.class, () -> validator.validateFilename(".."));
        assertThrows(EnvironmentSecurityException.class, () -> validator.validateFilename("a/b.md"));
        assertThrows(EnvironmentSecurityException.class, () -> validator.validateFilename("a\\b.md"));
        assertThrows(EnvironmentSecurityException.class, () -> validator.validateFilename("what?.md"));
        assertThrows(EnvironmentSecurityException.class, () -> validator.validateFilename("x".repeat(256)));
        assertThrows(EnvironmentSecurityException.class, () -> validator.validateFilename(""));
    }

    @Test
    void checksExtensionsAgainstAllowlist() {
        assertDoesNotThrow(() -> validator.validateExtension(".yml"));
        assertDoesNotThrow(() -> validator.validateExtension(".CSS"));
        assertThrows(EnvironmentSecurityException.class, () -> validator.validateExtension(".exe"));
        assertThrows(EnvironmentSecurityException.class, () -> validator.validateExtension(""));
    }

    @Test
    void emptyAllowlistAdmitsEverything() {
        var open = new SecurityValidator(SecurityConfig.builder().allowedExtensions(Set.of()).build());
        assertDoesNotThrow(() -> open.validateExtension(".exe"));
    }

    @Test
    void checksPerExtensionSize() {
        assertDoesNotThrow(() -> validator.validateFileSize(".md", 100 * 1024));
        assertThrows(EnvironmentSecurityException.class, () -> validator.validateFileSize(".md", 100 * 1024 + 1));
        assertThrows(EnvironmentSecurityException.class, () -> validator.validateFileSize(".pdf", 2L * 1024 * 1024));
        assertDoesNotThrow(() -> validator.validateFileSize(".unknown", 50L * 1024 * 1024));
    }

    @Test
    void validateFileCombinesSingleFileChecks() {
        assertDoesNotThrow(() -> validator.validateFile(FileInfo.of("workflows/blog/workflow.yml", 120)));
        assertThrows(EnvironmentSecurityException.class, () -> validator.validateFile(FileInfo.of("tools/run.sh", 10)));
    }

    @Test
    void aggregateLimitsCoverCountAndTotal() {
        var strict = new SecurityValidator(SecurityConfig.builder().maxFileCount(2).maxTotalSize(100).build());
        assertDoesNotThrow(() -> strict.validateFiles(List.of(FileInfo.of("a.md", 50), FileInfo.of("b.md", 50))));

        var tooMany = assertThrows(EnvironmentSecurityException.class, () -> strict.validateFiles(List.of(
            FileInfo.of("a.md", 1), FileInfo.of("b.md", 1), FileInfo.of("c.md", 1)
        )));
        assertTrue(tooMany.getMessage().contains("Too many files"));

        var tooLarge = assertThrows(EnvironmentSecurityException.class, () -> strict.validateFiles(List.of(
            FileInfo.of("a.md", 60), FileInfo.of("b.md", 41)
        )));
        assertTrue(tooLarge.getMessage().contains("Total file size"));
    }

    @Test
    void contentRulesRejectDeniedTagsAndNulCharacters() {
        var tagged = assertThrows(
            ValidationException.class,
            () -> validator.validateContent("workflow.yml", "value: !!java.lang.Runtime x")
        );
        assertTrue(tagged.getMessage().startsWith("Content validation failed for workflow.yml"));
        assertThrows(ValidationException.class, () -> validator.validateContent("notes.md", "a\0b"));
        assertDoesNotThrow(() -> validator.validateContent("notes.md", "!!java is fine outside YAML"));
    }

    @Test
    void contentBytesMustBeUtf8() {
        byte[] invalid = new byte[] { (byte) 0xC3, (byte) 0x28 };
        assertThrows(ValidationException.class, () -> validator.validateContent("notes.md", invalid));
        assertEquals("héllo", validator.validateContent("notes.md", "héllo".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void disabledContentValidationSkipsRules() {
        var lenient = new SecurityValidator(SecurityConfig.builder().enableContentValidation(false).build());
        assertDoesNotThrow(() -> lenient.validateContent("workflow.yml", "x: !!python/object y"));
    }

    @Test
    void identifiesCheckedContent() {
        assertTrue(validator.isContentChecked("workflows/blog/workflow.yml"));
        assertTrue(validator.isContentChecked("README.MD"));
        assertFalse(validator.isContentChecked("static/style.css"));
        assertFalse(validator.isContentChecked("logo.png"));
    }

    @Test
    void sanitizesDangerousCharacters() {
        assertEquals("a_b_c.md", validator.sanitizeFilename("a<b>c.md"));
    }
}
