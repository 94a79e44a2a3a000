package mail.taxonomy.app.provider;

import mail.taxonomy.app.entity.MailProvider;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Adapter per provider, fixed at construction time.
 */
public class FolderProviderRegistry {
    private final Map<MailProvider, FolderProviderAdapter> adapters = new EnumMap<>(MailProvider.class);

    public FolderProviderRegistry(List<FolderProviderAdapter> adapters) {
        for (FolderProviderAdapter adapter : adapters) {
            if (this.adapters.put(adapter.provider(), adapter) != null) {
                throw new IllegalStateException("Two folder adapters registered for " + adapter.provider());
            }
        }
    }

    public FolderProviderAdapter adapterFor(MailProvider provider) {
        FolderProviderAdapter adapter = adapters.get(provider);
        if (adapter == null) {
            throw new IllegalStateException("No folder adapter registered for provider: " + provider);
        }
        return adapter;
    }

    public Map<MailProvider, FolderProviderAdapter> adapters() {
        return Collections.unmodifiableMap(adapters);
    }
}
