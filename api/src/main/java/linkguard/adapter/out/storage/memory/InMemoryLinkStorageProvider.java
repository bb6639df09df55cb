package linkguard.adapter.out.storage.memory;

import linkguard.core.port.out.LinkRepository;
import linkguard.spi.LinkStorageProvider;

/**
 * Built-in link storage provider, always available, lowest priority.
 */
public class InMemoryLinkStorageProvider implements LinkStorageProvider {

    @Override
    public int priority() {
        return 0;
    }

    @Override
    public String name() {
        return "memory";
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public LinkRepository createRepository() {
        return new InMemoryLinkRepository();
    }
}
