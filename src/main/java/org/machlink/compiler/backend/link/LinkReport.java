package org.machlink.compiler.backend.link;

import org.machlink.compiler.frontend.module.ModuleId;

import java.util.List;

/**
 * Summary of a {@link LinkingPhase} run.
 *
 * @param order      The modules in the order they were linked.
 * @param links      Every reference that was resolved, with its result.
 * @param unresolved Every reference that could not be resolved.
 */
public record LinkReport(List<ModuleId> order, List<Link> links, List<Reference> unresolved) {

    /**
     * A resolved reference.
     *
     * @param reference The reference.
     * @param result    Its resolution.
     */
    public record Link(Reference reference, LinkResult result) {}

    public LinkReport {
        order = List.copyOf(order);
        links = List.copyOf(links);
        unresolved = List.copyOf(unresolved);
    }

    public boolean isComplete() {
        return unresolved.isEmpty();
    }

    public long crossFileLinkCount() {
        return links.stream().filter(l -> l.result().isCrossFile(l.reference().module())).count();
    }
}
