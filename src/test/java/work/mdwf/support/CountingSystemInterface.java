package work.mdwf.support;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import work.mdwf.system.NioSystemInterface;
import work.mdwf.system.SystemInterface;

/**
 * Delegates to the real file system and counts full-file reads.
 */
public final class CountingSystemInterface implements SystemInterface {
    private final SystemInterface delegate = NioSystemInterface.INSTANCE;
    private final AtomicInteger reads = new AtomicInteger();

    public int reads() {
        return reads.get();
    }

    @Override
    public boolean exists(Path path) {
        return delegate.exists(path);
    }

    @Override
    public boolean isDirectory(Path path) {
        return delegate.isDirectory(path);
    }

    @Override
    public boolean isRegularFile(Path path) {
        return delegate.isRegularFile(path);
    }

    @Override
    public long size(Path path) throws IOException {
        return delegate.size(path);
    }

    @Override
    public String readString(Path path) throws IOException {
        reads.incrementAndGet();
        return delegate.readString(path);
    }

    @Override
    public byte[] readBytes(Path path) throws IOException {
        reads.incrementAndGet();
        return delegate.readBytes(path);
    }

    @Override
    public List<DirEntry> list(Path directory) throws IOException {
        return delegate.list(directory);
    }
}
