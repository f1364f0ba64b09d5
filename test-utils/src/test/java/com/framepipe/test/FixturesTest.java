package com.framepipe.test;

import com.framepipe.frame.Frame;
import com.framepipe.frame.FramePersistenceException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FixturesTest {

    @Test
    void testStubGeneratorStampsIndex() {
        StubFrameGenerator generator = new StubFrameGenerator();

        Frame first = generator.generate();
        Frame second = generator.generate();

        assertEquals(0, first.pixels()[0]);
        assertEquals(1, second.pixels()[0]);
        assertEquals(2, generator.callCount());
    }

    @Test
    void testStubGeneratorFailsAfterLimit() {
        StubFrameGenerator generator = new StubFrameGenerator().failAfter(1);

        assertNotNull(generator.generate());
        assertThrows(IllegalStateException.class, generator::generate);
    }

    @Test
    void testScriptedPersisterFailsOnlyScriptedSequences() {
        ScriptedFramePersister persister = new ScriptedFramePersister(10).failOn(1);
        Frame frame = new StubFrameGenerator().generate();

        assertEquals(10, persister.persist(frame, 0));
        FramePersistenceException e = assertThrows(FramePersistenceException.class,
                () -> persister.persist(frame, 1));
        assertEquals(1, e.getSequenceNumber());
        assertEquals(10, persister.persist(frame, 2));

        assertEquals(3, persister.callCount());
        assertEquals(List.of(0L, 2L), persister.persistedSequences());
    }

    @Test
    void testRecordingOutputLocationCountsCalls() {
        RecordingOutputLocation location = new RecordingOutputLocation();
        assertFalse(location.wasPrepared());

        location.prepare();
        location.prepare();

        assertEquals(2, location.prepareCalls());
    }
}
