package com.quarry.formula.functions;

import java.time.ZoneId;

import com.quarry.formula.parser.FormulaContext;

/** What a function implementation sees besides its arguments. */
public final class Invocation {
    private final String functionName;
    private final int position;
    private final FormulaContext context;
    private final ContextualServices services;
    private final ZoneId zone;

    public Invocation(String functionName, int position, FormulaContext context, ContextualServices services, ZoneId defaultZone) {
        this.functionName = functionName;
        this.position = position;
        this.context = (context == null) ? FormulaContext.empty() : context;
        this.services = (services == null) ? new OfflineContextualServices() : services;
        ZoneId z = this.context.zone;
        this.zone = (z != null) ? z : (defaultZone == null ? ZoneId.of("UTC") : defaultZone);
    }

    public String functionName() { return functionName; }
    public int position() { return position; }
    public FormulaContext context() { return context; }
    public ContextualServices services() { return services; }

    /** Effective zone for calendar arithmetic: the context's zone, else the engine default. */
    public ZoneId zone() { return zone; }
}
