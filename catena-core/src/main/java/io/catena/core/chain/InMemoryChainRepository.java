package io.catena.core.chain;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/// In-memory chain repository (default implementation).
///
/// @implNote Uses ConcurrentHashMap for thread-safety.
public final class InMemoryChainRepository implements ChainRepository {

    private final Map<String, ChainDefinition> storage = new ConcurrentHashMap<>();

    @Override
    public void save(ChainDefinition chain) {
        Objects.requireNonNull(chain, "chain must not be null");
        storage.put(chain.getId(), chain);
    }

    @Override
    public Optional<ChainDefinition> findById(String chainId) {
        Objects.requireNonNull(chainId, "chainId must not be null");
        return Optional.ofNullable(storage.get(chainId));
    }

    @Override
    public List<ChainDefinition> findAll() {
        return List.copyOf(storage.values());
    }

    @Override
    public boolean exists(String chainId) {
        Objects.requireNonNull(chainId, "chainId must not be null");
        return storage.containsKey(chainId);
    }

    @Override
    public boolean delete(String chainId) {
        Objects.requireNonNull(chainId, "chainId must not be null");
        return storage.remove(chainId) != null;
    }
}
