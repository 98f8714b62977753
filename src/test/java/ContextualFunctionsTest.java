import com.quarry.formula.FormulaEngine;
import com.quarry.formula.functions.Coordinates;
import com.quarry.formula.functions.OfflineContextualServices;
import com.quarry.formula.parser.EntityRef;
import com.quarry.formula.parser.ErrorKind;
import com.quarry.formula.parser.EvaluationResult;
import com.quarry.formula.parser.FormulaContext;
import com.quarry.formula.parser.Value;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ContextualFunctionsTest {

    private static final FormulaEngine ENGINE = new FormulaEngine();

    private static FormulaContext ctx() {
        return FormulaContext.builder()
                .now(Instant.parse("2024-01-15T10:30:00Z"))
                .field("price", Value.number(100))
                .field("key", Value.text("price"))
                .field("origin", Value.map(Map.of("latitude", Value.number(0), "longitude", Value.number(0))))
                .field("east", Value.map(Map.of("lat", Value.text("0"), "lng", Value.text("1"))))
                .mention(new EntityRef("place", "Paris", "p1",
                        Map.of("latitude", Value.number(48.8566), "longitude", Value.number(2.3522))))
                .mention(new EntityRef("place", "Lyon", "p2",
                        Map.of("latitude", Value.number(45.7640), "longitude", Value.number(4.8357))))
                .mention(new EntityRef("place", "Atlantis"))
                .build();
    }

    private static EvaluationResult eval(String src) {
        return ENGINE.evaluateFormula(src, ctx()).join();
    }

    private static Value ok(String src) {
        EvaluationResult r = eval(src);
        assertTrue(r.isSuccess(), () -> src + " failed: " + r.error());
        return r.value();
    }

    @Test
    public void get_reads_fields() {
        assertEquals(Value.number(100), ok("GET(\"price\")"));
        assertEquals(Value.number(100), ok("GET(key)"));
        assertTrue(ok("GET(\"nope\")").isNull());
    }

    @Test
    public void mention_matches_label_case_insensitively() {
        Value paris = ok("MENTION(\"paris\")");
        assertEquals(Value.text("Paris"), paris.get("label"));
        assertEquals(Value.text("place"), paris.get("type"));
        assertEquals(Value.text("p1"), paris.get("id"));
        assertTrue(ok("MENTION(\"Berlin\")").isNull());
    }

    @Test
    public void distance_between_mentioned_places() {
        double km = ok("DISTANCE(\"Paris\", \"Lyon\")").asNumber();
        assertEquals(391.5, km, 1.0);
        assertEquals(km, Math.round(km * 10) / 10.0, 0.0);
    }

    @Test
    public void distance_from_map_values() {
        assertEquals(111.2, ok("DISTANCE(origin, east)").asNumber(), 0.0);
        assertEquals(0.0, ok("DISTANCE(origin, origin)").asNumber(), 0.0);
    }

    @Test
    public void distance_without_coordinates_is_runtime_error() {
        EvaluationResult r = eval("DISTANCE(\"Paris\", \"Atlantis\")");
        assertEquals(ErrorKind.RUNTIME_ERROR, r.error().kind());
        assertEquals("DISTANCE", r.error().functionName());
        assertEquals(1, r.error().argumentIndex());

        assertEquals(ErrorKind.TYPE_ERROR, eval("DISTANCE(1, 2)").error().kind());
    }

    @Test
    public void offline_weather_and_route_report_missing_provider() {
        Value weather = ok("WEATHER(\"Paris\")");
        assertEquals(Value.text("Paris"), weather.get("place"));
        assertEquals(Value.text("2024-01-15"), weather.get("date"));
        assertEquals(Value.text("Unknown"), weather.get("condition"));
        assertFalse(weather.get("message").isNull());

        Value later = ok("WEATHER(\"Nice\", DATEADD(NOW(), 3))");
        assertEquals(Value.text("Nice"), later.get("place"));
        assertEquals(Value.text("2024-01-18"), later.get("date"));

        Value route = ok("ROUTE(\"Paris\", \"Lyon\")");
        assertEquals(Value.text("Paris"), route.get("from"));
        assertEquals(Value.text("Lyon"), route.get("to"));
        assertEquals(Value.text("drive"), route.get("mode"));
        assertEquals(Value.text("transit"), ok("ROUTE(\"Paris\", \"Lyon\", \"transit\")").get("mode"));
    }

    @Test
    public void haversine() {
        assertEquals(111.2, OfflineContextualServices.haversineKm(new Coordinates(0, 0), new Coordinates(0, 1)), 0.0);
        assertThrows(IllegalArgumentException.class, () -> new Coordinates(91, 0));
    }
}
