package com.funnelanalytics.infrastructure.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.funnelanalytics.domain.exception.StorageFailureException;
import com.funnelanalytics.domain.model.FunnelStep;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class JsonColumnMapperTest {

    private final JsonColumnMapper mapper = new JsonColumnMapper(new ObjectMapper());

    @Test
    void testReadSteps_ParsesStoredSteps() {
        List<FunnelStep> steps = mapper.readSteps(
                "[{\"name\":\"Visit\",\"order\":0},{\"name\":\"Signup\",\"order\":1,\"conditions\":{\"page\":\"/join\"}}]",
                UUID.randomUUID());

        assertEquals(2, steps.size());
        assertEquals("Signup", steps.get(1).getName());
        assertEquals("/join", steps.get(1).getConditions().get("page"));
    }

    @Test
    void testReadSteps_CorruptStepsAreStorageFailure() {
        UUID funnelId = UUID.randomUUID();

        StorageFailureException ex = assertThrows(StorageFailureException.class,
                () -> mapper.readSteps("[{\"name\":", funnelId));

        assertTrue(ex.getMessage().contains(funnelId.toString()));
    }

    @Test
    void testReadSteps_EmptyColumnIsNoSteps() {
        assertTrue(mapper.readSteps(null, UUID.randomUUID()).isEmpty());
    }

    @Test
    void testReadMap_UnreadableMetadataIsAbsent() {
        assertNull(mapper.readMap("{broken", UUID.randomUUID()));
    }
}
