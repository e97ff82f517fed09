package com.portfolio.service;

import com.portfolio.entity.IdentityKeys;
import lombok.Value;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Rebuilds an ordered, persistent child list so that it holds exactly the
 * children described by a payload list, in payload order.
 *
 * Children are matched by id. A matched child is updated in place and keeps its
 * row; a payload entry without a usable id produces a new child; children not
 * named by the payload are dropped (and deleted by orphan removal). The managed
 * list is edited position by position instead of being cleared and refilled.
 *
 * An id is not usable when it already appeared earlier in the same payload or
 * when another parent owns it. Such entries get a fresh id.
 */
public final class ChildListReconciler {

    private ChildListReconciler() {
    }

    /**
     * How one kind of child is identified, created and updated.
     *
     * @param <E> child entity type
     * @param <P> payload type
     */
    public interface Binding<E, P> {

        String entityId(E entity);

        String payloadId(P payload);

        /**
         * @param id candidate id for a new child
         * @return true if a child under another parent already uses this id
         */
        boolean isOwnedElsewhere(String id);

        String newId();

        E create(String id, P payload);

        void update(E entity, P payload);
    }

    /**
     * Counts of what a reconciliation did, for logging.
     */
    @Value
    public static class Result {
        int created;
        int updated;
        int removed;

        @Override
        public String toString() {
            return String.format("%d created, %d updated, %d removed", created, updated, removed);
        }
    }

    /**
     * Reconcile {@code current} against {@code payloads}.
     *
     * @param current the managed child list, modified in place
     * @param payloads desired children in order, may be null
     * @param binding how to identify, create and update children
     * @return counts of created, updated and removed children
     */
    public static <E, P> Result reconcile(List<E> current, List<P> payloads, Binding<E, P> binding) {
        Map<String, E> existing = new LinkedHashMap<>();
        for (E entity : current) {
            existing.put(binding.entityId(entity), entity);
        }

        Set<String> claimed = new HashSet<>();
        List<E> desired = new ArrayList<>();
        int created = 0;
        int updated = 0;

        if (payloads != null) {
            for (P payload : payloads) {
                String requestedId = IdentityKeys.trimToNull(binding.payloadId(payload));
                E entity = null;

                if (requestedId != null && claimed.add(requestedId)) {
                    entity = existing.get(requestedId);
                    if (entity == null && binding.isOwnedElsewhere(requestedId)) {
                        requestedId = null;
                    }
                } else {
                    requestedId = null;
                }

                if (entity != null) {
                    binding.update(entity, payload);
                    updated++;
                } else {
                    String id = requestedId != null ? requestedId : freshId(binding, claimed, existing);
                    entity = binding.create(id, payload);
                    created++;
                }
                desired.add(entity);
            }
        }

        Map<E, Boolean> kept = new IdentityHashMap<>();
        desired.forEach(entity -> kept.put(entity, Boolean.TRUE));
        int removed = (int) current.stream().filter(entity -> !kept.containsKey(entity)).count();

        for (int i = 0; i < desired.size(); i++) {
            if (i < current.size()) {
                if (current.get(i) != desired.get(i)) {
                    current.set(i, desired.get(i));
                }
            } else {
                current.add(desired.get(i));
            }
        }
        while (current.size() > desired.size()) {
            current.remove(current.size() - 1);
        }

        return new Result(created, updated, removed);
    }

    private static <E, P> String freshId(Binding<E, P> binding, Set<String> claimed, Map<String, E> existing) {
        String id = binding.newId();
        while (existing.containsKey(id) || !claimed.add(id)) {
            id = binding.newId();
        }
        return id;
    }
}
