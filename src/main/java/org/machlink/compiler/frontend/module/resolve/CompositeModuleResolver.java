package org.machlink.compiler.frontend.module.resolve;

import org.machlink.compiler.frontend.module.ModuleId;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Ordered trial list of resolvers. Every resolver whose {@link #canResolve} holds is tried in
 * order until one produces a result; the first success wins.
 */
public class CompositeModuleResolver implements ModuleResolver {

    private final List<ModuleResolver> resolvers;

    public CompositeModuleResolver(List<ModuleResolver> resolvers) {
        this.resolvers = new CopyOnWriteArrayList<>(resolvers);
    }

    public void addResolver(ModuleResolver resolver) {
        resolvers.add(resolver);
    }

    public List<ModuleResolver> getResolvers() {
        return List.copyOf(resolvers);
    }

    @Override
    public boolean canResolve(String importPath, ModuleId from) {
        return resolvers.stream().anyMatch(r -> r.canResolve(importPath, from));
    }

    @Override
    public CompletableFuture<Optional<ResolvedModule>> resolve(String importPath, ModuleId from) {
        List<ModuleResolver> capable = new ArrayList<>();
        for (ModuleResolver resolver : resolvers) {
            if (resolver.canResolve(importPath, from)) {
                capable.add(resolver);
            }
        }
        return tryFrom(capable, 0, importPath, from);
    }

    private CompletableFuture<Optional<ResolvedModule>> tryFrom(List<ModuleResolver> capable, int index,
                                                                String importPath, ModuleId from) {
        if (index >= capable.size()) {
            return CompletableFuture.completedFuture(Optional.empty());
        }
        return capable.get(index).resolve(importPath, from).thenCompose(result -> result.isPresent()
                ? CompletableFuture.completedFuture(result)
                : tryFrom(capable, index + 1, importPath, from));
    }
}
