package com.portfolio.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ChildListReconciler Unit Tests")
class ChildListReconcilerTest {

    private final IdGenerator idGenerator = new IdGenerator();

    @Test
    @DisplayName("reconcile should update matches in place, create new children and drop missing ones")
    void testReconcile_ReplaceSemantics() {
        // Arrange
        Item first = new Item("task-1", "Design");
        Item second = new Item("task-2", "Build");
        List<Item> current = new ArrayList<>(Arrays.asList(first, second));

        // Act
        ChildListReconciler.Result result = ChildListReconciler.reconcile(current,
                Arrays.asList(new Draft("task-2", "Build v2"), new Draft(null, "Ship")),
                new ItemBinding(Set.of()));

        // Assert
        assertEquals(2, current.size());
        assertSame(second, current.get(0));
        assertEquals("Build v2", second.title);
        assertEquals("Ship", current.get(1).title);
        assertTrue(current.get(1).id.startsWith("task-"));
        assertEquals(1, result.getCreated());
        assertEquals(1, result.getUpdated());
        assertEquals(1, result.getRemoved());
    }

    @Test
    @DisplayName("reconcile should follow payload order")
    void testReconcile_Reorders() {
        // Arrange
        Item first = new Item("a", "A");
        Item second = new Item("b", "B");
        List<Item> current = new ArrayList<>(Arrays.asList(first, second));

        // Act
        ChildListReconciler.reconcile(current,
                Arrays.asList(new Draft("b", "B"), new Draft("a", "A")),
                new ItemBinding(Set.of()));

        // Assert
        assertSame(second, current.get(0));
        assertSame(first, current.get(1));
    }

    @Test
    @DisplayName("reconcile should give a fresh id to a repeated payload id")
    void testReconcile_DuplicatePayloadId() {
        // Arrange
        List<Item> current = new ArrayList<>();

        // Act
        ChildListReconciler.reconcile(current,
                Arrays.asList(new Draft("task-9", "One"), new Draft("task-9", "Two")),
                new ItemBinding(Set.of()));

        // Assert
        assertEquals(2, current.size());
        assertEquals("task-9", current.get(0).id);
        assertNotEquals("task-9", current.get(1).id);
        assertEquals(2, new HashSet<>(Arrays.asList(current.get(0).id, current.get(1).id)).size());
    }

    @Test
    @DisplayName("reconcile should not reuse an id owned by another parent")
    void testReconcile_IdOwnedElsewhere() {
        // Arrange
        List<Item> current = new ArrayList<>();

        // Act
        ChildListReconciler.reconcile(current,
                List.of(new Draft("task-foreign", "Copied")),
                new ItemBinding(Set.of("task-foreign")));

        // Assert
        assertEquals(1, current.size());
        assertNotEquals("task-foreign", current.get(0).id);
        assertEquals("Copied", current.get(0).title);
    }

    @Test
    @DisplayName("reconcile should empty the list for a null payload")
    void testReconcile_NullPayload() {
        // Arrange
        List<Item> current = new ArrayList<>(List.of(new Item("a", "A"), new Item("b", "B")));

        // Act
        ChildListReconciler.Result result = ChildListReconciler.reconcile(current, null, new ItemBinding(Set.of()));

        // Assert
        assertTrue(current.isEmpty());
        assertEquals(2, result.getRemoved());
        assertEquals("0 created, 0 updated, 2 removed", result.toString());
    }

    private static class Item {
        private final String id;
        private String title;

        Item(String id, String title) {
            this.id = id;
            this.title = title;
        }
    }

    private static class Draft {
        private final String id;
        private final String title;

        Draft(String id, String title) {
            this.id = id;
            this.title = title;
        }
    }

    private class ItemBinding implements ChildListReconciler.Binding<Item, Draft> {
        private final Set<String> foreignIds;

        ItemBinding(Set<String> foreignIds) {
            this.foreignIds = foreignIds;
        }

        @Override
        public String entityId(Item entity) {
            return entity.id;
        }

        @Override
        public String payloadId(Draft payload) {
            return payload.id;
        }

        @Override
        public boolean isOwnedElsewhere(String id) {
            return foreignIds.contains(id);
        }

        @Override
        public String newId() {
            return idGenerator.newId("task");
        }

        @Override
        public Item create(String id, Draft payload) {
            return new Item(id, payload.title);
        }

        @Override
        public void update(Item entity, Draft payload) {
            entity.title = payload.title;
        }
    }
}
