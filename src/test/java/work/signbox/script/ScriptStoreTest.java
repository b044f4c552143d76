package work.signbox.script;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import work.signbox.api.ErrorKind;
import work.signbox.api.SigningException;

class ScriptStoreTest {
    private static final ScriptValidator REJECT_BROKEN = candidate -> {
        if (candidate.source().contains("broken")) {
            throw new SigningException(ErrorKind.SANDBOX_BUILD_ERROR, "broken script");
        }
    };

    @Test
    void loadPublishesAndVersions() {
        ScriptStore store = new ScriptStore(ScriptValidator.ACCEPT_ALL, 5);
        assertFalse(store.hasScript());

        AlgorithmScript first = store.load("function sign_detail(){ return 'a'; }");
        AlgorithmScript second = store.load("function sign_detail(){ return 'b'; }");

        assertEquals(1, first.version());
        assertEquals(2, second.version());
        assertSame(second, store.current());
        assertEquals(List.of(first), store.history());
    }

    @Test
    void identicalSourceIsANoOp() {
        ScriptStore store = new ScriptStore(ScriptValidator.ACCEPT_ALL, 5);
        AlgorithmScript first = store.load("function sign_detail(){ return 'a'; }");
        AlgorithmScript again = store.load("function sign_detail(){ return 'a'; }");
        assertSame(first, again);
        assertTrue(store.history().isEmpty());
    }

    @Test
    void rejectedScriptKeepsPreviousActive() {
        ScriptStore store = new ScriptStore(REJECT_BROKEN, 5);
        AlgorithmScript good = store.load("function sign_detail(){ return 'ok'; }");

        SigningException ex = assertThrows(SigningException.class, () -> store.load("broken"));

        assertEquals(ErrorKind.SCRIPT_INVALID, ex.kind());
        assertSame(good, store.current());
        assertTrue(store.history().isEmpty());
    }

    @Test
    void blankSourceIsInvalid() {
        ScriptStore store = new ScriptStore(ScriptValidator.ACCEPT_ALL, 5);
        assertEquals(ErrorKind.SCRIPT_INVALID, assertThrows(SigningException.class, () -> store.load("  ")).kind());
        assertEquals(ErrorKind.SERVICE_UNAVAILABLE, assertThrows(SigningException.class, store::current).kind());
    }

    @Test
    void historyIsBounded() {
        ScriptStore store = new ScriptStore(ScriptValidator.ACCEPT_ALL, 2);
        for (int i = 0; i < 5; i++) {
            store.load("var v = " + i + ";");
        }
        List<AlgorithmScript> history = store.history();
        assertEquals(2, history.size());
        assertEquals(4, history.get(0).version());
        assertEquals(3, history.get(1).version());
    }

    @Test
    void rollbackRestoresPreviousSource() {
        ScriptStore store = new ScriptStore(ScriptValidator.ACCEPT_ALL, 5);
        AlgorithmScript first = store.load("var v = 1;");
        store.load("var v = 2;");

        AlgorithmScript restored = store.rollback();

        assertEquals(first.hash(), restored.hash());
        assertNotEquals(first.version(), restored.version());
        assertEquals(restored, store.current());
        assertEquals(ErrorKind.SCRIPT_INVALID, assertThrows(SigningException.class, store::rollback).kind());
    }

    @Test
    void loadFileReadsFromDisk() throws Exception {
        Path dir = Files.createTempDirectory("signbox-script");
        Path file = dir.resolve("algo.js");
        Files.writeString(file, "function sign_detail(){ return 'disk'; }");
        ScriptStore store = new ScriptStore(ScriptValidator.ACCEPT_ALL, 5);

        assertEquals(1, store.loadFile(file).version());
        assertEquals(ErrorKind.SCRIPT_INVALID,
            assertThrows(SigningException.class, () -> store.loadFile(dir.resolve("missing.js"))).kind());
    }
}
