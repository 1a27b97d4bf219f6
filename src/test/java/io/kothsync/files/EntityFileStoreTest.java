package io.kothsync.files;

import io.kothsync.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

final class EntityFileStoreTest {

    @Test
    void fileNamesMapToEntityIds() {
        Assertions.assertEquals(Optional.of("alice"), EntityFileStore.entityIdOf("alice.json"));
        Assertions.assertEquals(Optional.of("76561198000000001"), EntityFileStore.entityIdOf("76561198000000001.json"));
        Assertions.assertEquals(Optional.empty(), EntityFileStore.entityIdOf("ServerSettings.json"));
        Assertions.assertEquals(Optional.empty(), EntityFileStore.entityIdOf("serversettings.json"));
        Assertions.assertEquals(Optional.empty(), EntityFileStore.entityIdOf("PlayerList.json"));
        Assertions.assertEquals(Optional.empty(), EntityFileStore.entityIdOf("alice.JSON"));
        Assertions.assertEquals(Optional.empty(), EntityFileStore.entityIdOf("alice.txt"));
        Assertions.assertEquals(Optional.empty(), EntityFileStore.entityIdOf(".alice.json.tmp"));
        Assertions.assertEquals(Optional.empty(), EntityFileStore.entityIdOf(".json"));
        Assertions.assertEquals(Optional.empty(), EntityFileStore.entityIdOf("a b.json"));
    }

    @Test
    void listingSkipsReservedAndForeignFiles() throws Exception {
        Path root = Files.createTempDirectory("kothsync-test-files-");
        try {
            Files.writeString(root.resolve("bob.json"), "{}", StandardCharsets.UTF_8);
            Files.writeString(root.resolve("alice.json"), "{}", StandardCharsets.UTF_8);
            Files.writeString(root.resolve("ServerSettings.json"), "{}", StandardCharsets.UTF_8);
            Files.writeString(root.resolve("PlayerList.json"), "{}", StandardCharsets.UTF_8);
            Files.writeString(root.resolve("notes.txt"), "x", StandardCharsets.UTF_8);
            Files.createDirectories(root.resolve("nested.json"));

            List<EntityFileStore.EntityFile> files = new EntityFileStore(root).listEntityFiles();

            Assertions.assertEquals(List.of("alice", "bob"), files.stream().map(EntityFileStore.EntityFile::entityId).toList());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void writeReplacesContentAndLeavesNoTempFile() throws Exception {
        Path root = Files.createTempDirectory("kothsync-test-files-");
        try {
            EntityFileStore store = new EntityFileStore(root);
            Files.writeString(store.pathFor("alice"), "{\"old\":true}", StandardCharsets.UTF_8);

            store.write("alice", Jsons.parse("{\"hp\":100,\"stats\":{\"kills\":1}}"));

            Assertions.assertEquals(Jsons.parse("{\"hp\":100,\"stats\":{\"kills\":1}}"), store.read("alice"));
            Assertions.assertTrue(store.readRaw("alice").contains("\n"));
            Assertions.assertFalse(Files.exists(root.resolve(".alice.json.tmp")));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void malformedDocumentSurfacesAsIOException() throws Exception {
        Path root = Files.createTempDirectory("kothsync-test-files-");
        try {
            EntityFileStore store = new EntityFileStore(root);
            Files.writeString(store.pathFor("bad"), "{\"hp\":", StandardCharsets.UTF_8);
            Files.writeString(store.pathFor("blank"), "   ", StandardCharsets.UTF_8);
            Files.writeString(store.pathFor("torn"), "{\"hp\":100}} truncated-write-garbage", StandardCharsets.UTF_8);
            Files.writeString(store.pathFor("twice"), "{\"hp\":1}{\"hp\":2}", StandardCharsets.UTF_8);

            Assertions.assertThrows(IOException.class, () -> store.read("bad"));
            Assertions.assertThrows(IOException.class, () -> store.read("blank"));
            Assertions.assertThrows(IOException.class, () -> store.read("torn"));
            Assertions.assertThrows(IOException.class, () -> store.read("twice"));
            Assertions.assertThrows(IOException.class, () -> store.read("missing"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void allowListToleratesMissingAndMalformedFiles() throws Exception {
        Path root = Files.createTempDirectory("kothsync-test-files-");
        try {
            EntityFileStore store = new EntityFileStore(root);
            Assertions.assertTrue(store.readAllowList().isEmpty());

            Files.writeString(store.pathFor(EntityFileStore.ALLOW_LIST_ID), "[oops", StandardCharsets.UTF_8);
            Assertions.assertTrue(store.readAllowList().isEmpty());

            Files.writeString(store.pathFor(EntityFileStore.ALLOW_LIST_ID), "{\"players\":\"alice\"}", StandardCharsets.UTF_8);
            Assertions.assertTrue(store.readAllowList().isEmpty());

            Files.writeString(store.pathFor(EntityFileStore.ALLOW_LIST_ID),
                    "{\"players\":[\"alice\",\"bob\",\"alice\",\"\",76561198000000001]}", StandardCharsets.UTF_8);
            Assertions.assertEquals(Set.of("alice", "bob", "76561198000000001"), store.readAllowList());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void missingDirectoryIsReported() throws Exception {
        Path root = Files.createTempDirectory("kothsync-test-files-");
        try {
            Assertions.assertTrue(new EntityFileStore(root).directoryExists());
            Assertions.assertFalse(new EntityFileStore(root.resolve("absent")).directoryExists());
        } finally {
            deleteRecursively(root);
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
