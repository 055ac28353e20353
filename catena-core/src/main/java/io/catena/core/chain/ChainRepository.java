package io.catena.core.chain;

import java.util.List;
import java.util.Optional;

/// Storage for chain definitions.
///
/// {@link #save} is idempotent: saving a chain whose id already exists replaces the
/// previous definition. Executions already running keep the definition they started
/// with.
///
/// @see InMemoryChainRepository for the default implementation
/// @see ChainRegistry for validated registration
public interface ChainRepository {

    /// Saves a chain definition, replacing any previous one with the same id.
    ///
    /// @param chain the definition to store, not null
    void save(ChainDefinition chain);

    /// Finds a chain by id.
    ///
    /// @param chainId chain identifier, not null
    /// @return the chain if found, empty otherwise
    Optional<ChainDefinition> findById(String chainId);

    /// Lists every stored chain.
    ///
    /// @return list of chains, never null (may be empty)
    List<ChainDefinition> findAll();

    /// Checks whether a chain is stored.
    ///
    /// @param chainId chain identifier, not null
    /// @return true if the chain exists
    boolean exists(String chainId);

    /// Deletes a chain.
    ///
    /// @param chainId chain identifier, not null
    /// @return true if the chain was deleted, false if not found
    boolean delete(String chainId);
}
