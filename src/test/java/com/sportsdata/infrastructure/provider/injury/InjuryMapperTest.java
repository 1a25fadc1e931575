package com.sportsdata.infrastructure.provider.injury;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sportsdata.domain.exception.TransformException;
import com.sportsdata.domain.model.InjuryData;
import com.sportsdata.domain.model.InjurySeverity;
import com.sportsdata.domain.model.InjuryStatus;
import com.sportsdata.infrastructure.provider.payload.InjuryReportPayload;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InjuryMapperTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void testMapsReportAndAppliesDefaults() throws Exception {
        String json = """
            [
              {"player_id": "p1", "type": "Ankle", "severity": "season_ending", "status": "out", "expected_return": "2024-10-01", "impact": 0.8},
              {"player_id": "p2", "type": "Knee", "status": "Day-To-Day"},
              {"player_id": "p3", "impact": 0}
            ]
            """;

        List<InjuryData> injuries = InjuryMapper.toInjuries(objectMapper.readValue(json, InjuryReportPayload.class));

        assertEquals(3, injuries.size());
        assertEquals(InjurySeverity.SEASON_ENDING, injuries.get(0).severity());
        assertEquals(InjuryStatus.OUT, injuries.get(0).status());
        assertEquals(0.8, injuries.get(0).impact());

        assertEquals(InjurySeverity.MINOR, injuries.get(1).severity());
        assertEquals(InjuryStatus.DAY_TO_DAY, injuries.get(1).status());
        assertEquals(InjuryData.DEFAULT_IMPACT, injuries.get(1).impact());

        assertEquals("unknown", injuries.get(2).type());
        assertEquals(InjuryStatus.QUESTIONABLE, injuries.get(2).status());
        assertEquals(InjuryData.DEFAULT_IMPACT, injuries.get(2).impact());
    }

    @Test
    void testEmptyReport() throws Exception {
        assertTrue(InjuryMapper.toInjuries(objectMapper.readValue("[]", InjuryReportPayload.class)).isEmpty());
    }

    @Test
    void testEntryWithoutPlayerIsRejected() throws Exception {
        InjuryReportPayload payload = objectMapper.readValue("[{\"type\": \"Ankle\"}]", InjuryReportPayload.class);

        assertThrows(TransformException.class, () -> InjuryMapper.toInjuries(payload));
    }
}
