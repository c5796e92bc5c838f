package com.scipatom.atomizer;

import com.scipatom.atomizer.resolve.AtomIds;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AtomIdsTest {

    @Test
    void folderAndFileIds() {
        assertEquals("folder:", AtomIds.forFolder(""));
        assertEquals("folder:src/net", AtomIds.forFolder("src/net"));
        assertEquals("file:src/net/client.rs", AtomIds.forFile("src/net/client.rs"));
    }

    @Test
    void freeFunction() {
        assertEquals("fn:demo/util/parse",
            AtomIds.forFunction("rust-analyzer cargo demo 0.1.0 util/parse().", "parse"));
    }

    @Test
    void methodKeepsOwningType() {
        assertEquals("fn:demo/net/Client/send",
            AtomIds.forFunction("rust-analyzer cargo demo 0.1.0 net/Client#send().", "send"));
    }

    @Test
    void traitImplKeepsTypeAndTraitWithoutGenerics() {
        assertEquals("fn:demo/impl/Wrapper/Display/fmt",
            AtomIds.forFunction("rust-analyzer cargo demo 0.1.0 impl#[`Wrapper<T>`][Display]fmt().", "fmt"));
    }

    @Test
    void displayNameAppendedWhenMissing() {
        assertEquals("fn:demo/handlers/on_event",
            AtomIds.forFunction("rust-analyzer cargo demo 0.1.0 handlers/", "on_event"));
    }

    @Test
    void deterministicAcrossCalls() {
        String symbol = "rust-analyzer cargo demo 0.1.0 a/b().";
        assertEquals(AtomIds.forFunction(symbol, "b"), AtomIds.forFunction(symbol, "b"));
    }
}
