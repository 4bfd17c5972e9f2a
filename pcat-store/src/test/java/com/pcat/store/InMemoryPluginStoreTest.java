package com.pcat.store;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class InMemoryPluginStoreTest {

    private static PluginDescriptor plugin(String id, String version) {
        return new PluginDescriptor(id, "step", id + " plugin", version, "name: " + id + "\n", "");
    }

    @Test
    void createThenFind() {
        InMemoryPluginStore store = new InMemoryPluginStore();
        store.create(plugin("docker", "1"));

        assertEquals("docker", store.find("docker", null).getIdentifier());
        assertEquals("docker", store.find("docker", "").getIdentifier());
        assertEquals("docker", store.find("docker", "1").getIdentifier());
        assertThrows(PluginNotFoundException.class, () -> store.find("docker", "2"));
        assertThrows(PluginNotFoundException.class, () -> store.find("missing", null));
    }

    @Test
    void createRejectsExistingIdentifier() {
        InMemoryPluginStore store = new InMemoryPluginStore();
        store.create(plugin("docker", "1"));

        PluginStoreException e = assertThrows(PluginStoreException.class, () -> store.create(plugin("docker", "2")));
        assertEquals("Plugin already exists: docker", e.getMessage());
        assertEquals("1", store.find("docker", null).getVersion());
    }

    @Test
    void updateRequiresExistingIdentifier() {
        InMemoryPluginStore store = new InMemoryPluginStore();
        assertThrows(PluginNotFoundException.class, () -> store.update(plugin("docker", "1")));

        store.create(plugin("docker", "1"));
        store.update(plugin("docker", "2"));
        assertEquals("2", store.find("docker", null).getVersion());
        assertEquals(1, store.size());
    }

    @Test
    void listAndCountApplyFilter() {
        InMemoryPluginStore store = new InMemoryPluginStore();
        for (String id : List.of("slack", "docker", "docker-buildx", "kaniko", "s3")) {
            store.create(plugin(id, ""));
        }

        assertEquals(List.of("docker", "docker-buildx", "kaniko", "s3", "slack"),
                store.listAll().stream().map(PluginDescriptor::getIdentifier).collect(Collectors.toList()));
        assertEquals(2, store.count(PluginFilter.query("DOCK")));
        assertEquals(5, store.count(null));
        assertEquals(List.of("kaniko", "s3"),
                store.list(new PluginFilter(null, 2, 2)).stream().map(PluginDescriptor::getIdentifier).collect(Collectors.toList()));
        assertEquals(List.of("docker-buildx"),
                store.list(new PluginFilter("docker", 2, 1)).stream().map(PluginDescriptor::getIdentifier).collect(Collectors.toList()));
    }
}
