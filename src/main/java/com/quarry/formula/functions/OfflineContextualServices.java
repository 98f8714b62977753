package com.quarry.formula.functions;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import com.quarry.formula.parser.Value;

/**
 * Provider used when the host configures none. Distance is computed locally (great-circle,
 * haversine); Weather and Route answer with placeholder payloads saying no provider is set up.
 */
public class OfflineContextualServices implements ContextualServices {

    static final double EARTH_RADIUS_KM = 6371.0;

    @Override
    public CompletableFuture<Value> weather(Invocation call, Value place, Instant date) {
        Map<String, Value> out = new LinkedHashMap<>();
        out.put("place", Value.text(placeName(place)));
        out.put("date", Value.text(DateTimeFormatter.ISO_LOCAL_DATE.format(date.atZone(call.zone()))));
        out.put("condition", Value.text("Unknown"));
        out.put("temperature", Value.text("--°"));
        out.put("message", Value.text("Weather provider not configured"));
        return CompletableFuture.completedFuture(Value.map(out));
    }

    @Override
    public CompletableFuture<Value> route(Invocation call, Value from, Value to, String mode) {
        Map<String, Value> out = new LinkedHashMap<>();
        out.put("from", Value.text(placeName(from)));
        out.put("to", Value.text(placeName(to)));
        out.put("mode", Value.text(mode));
        out.put("distance", Value.text("-- km"));
        out.put("duration", Value.text("-- min"));
        out.put("message", Value.text("Routing provider not configured"));
        return CompletableFuture.completedFuture(Value.map(out));
    }

    @Override
    public CompletableFuture<Value> distance(Invocation call, Coordinates from, Coordinates to) {
        return CompletableFuture.completedFuture(Value.number(haversineKm(from, to)));
    }

    /** Great-circle distance in km, rounded to one decimal. */
    public static double haversineKm(Coordinates a, Coordinates b) {
        double dLat = Math.toRadians(b.latitude - a.latitude);
        double dLng = Math.toRadians(b.longitude - a.longitude);
        double h = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(Math.toRadians(a.latitude)) * Math.cos(Math.toRadians(b.latitude))
                * Math.sin(dLng / 2) * Math.sin(dLng / 2);
        double km = EARTH_RADIUS_KM * 2 * Math.atan2(Math.sqrt(h), Math.sqrt(1 - h));
        return BigDecimal.valueOf(km).setScale(1, RoundingMode.HALF_UP).doubleValue();
    }

    static String placeName(Value place) {
        if (place.getType() == Value.Type.MAP) {
            Value label = place.get("label");
            if (!label.isNull()) return label.display();
        }
        return place.display();
    }
}
