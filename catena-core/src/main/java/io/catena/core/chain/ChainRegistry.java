package io.catena.core.chain;

import io.catena.core.exception.ChainNotFoundException;
import io.catena.core.exception.ValidationException;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Logger;

/// Validated entry point for storing chains and looking them up during execution.
///
/// Registration checks that every chain a definition can start, through chain call
/// steps or `jump_to_chain` rules, is either already stored or part of the same
/// registration batch. Self references are allowed; cycles are cut at run time by the
/// recursion depth limit.
///
/// @see ChainRepository for storage
public class ChainRegistry {

    private static final Logger logger = Logger.getLogger(ChainRegistry.class.getName());

    private final ChainRepository repository;

    public ChainRegistry(ChainRepository repository) {
        this.repository = Objects.requireNonNull(repository, "repository must not be null");
    }

    /// Validates references of a single chain and stores it.
    ///
    /// @param chain chain to register, not null
    /// @throws ValidationException if the chain references an unknown chain
    public void register(ChainDefinition chain) {
        registerAll(List.of(chain));
    }

    /// Validates references of a batch of chains against each other and the stored
    /// chains, then stores all of them.
    ///
    /// Nothing is stored if any chain in the batch fails validation.
    ///
    /// @param chains chains to register, not null
    /// @throws ValidationException if any chain references an unknown chain
    public void registerAll(List<ChainDefinition> chains) {
        Objects.requireNonNull(chains, "chains must not be null");

        Set<String> batchIds = new HashSet<>();
        chains.forEach(chain -> batchIds.add(chain.getId()));

        for (ChainDefinition chain : chains) {
            Set<String> missing = new TreeSet<>();
            for (String referenced : chain.referencedChainIds()) {
                if (!batchIds.contains(referenced) && !repository.exists(referenced)) {
                    missing.add(referenced);
                }
            }
            if (!missing.isEmpty()) {
                throw new ValidationException(
                        "Chain '" + chain.getId() + "' references unknown chains: " + missing);
            }
        }

        for (ChainDefinition chain : chains) {
            repository.save(chain);
            logger.info(
                    "Registered chain: "
                            + chain.getId()
                            + " ("
                            + chain.getSteps().size()
                            + " steps)");
        }
    }

    /// Returns a registered chain.
    ///
    /// @param chainId chain identifier, not null
    /// @return the chain, never null
    /// @throws ChainNotFoundException if no chain is registered under that id
    public ChainDefinition require(String chainId) {
        return repository.findById(chainId).orElseThrow(() -> new ChainNotFoundException(chainId));
    }

    public Optional<ChainDefinition> find(String chainId) {
        return repository.findById(chainId);
    }

    public List<ChainDefinition> list() {
        return repository.findAll();
    }

    public boolean remove(String chainId) {
        return repository.delete(chainId);
    }
}
