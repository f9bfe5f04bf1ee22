package com.pandora.orchestrator.library;

import com.pandora.orchestrator.function.StepFunction;
import com.pandora.orchestrator.runtime.RunContext;
import com.pandora.orchestrator.runtime.TimeWindows;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/** Publishes the run's resolved analysis and comparison windows. */
@Component
public class ResolveTimeWindowsFunction implements StepFunction {

    @Override
    public String name() { return "resolveTimeWindows"; }

    @Override
    public Object apply(Map<String, Object> args, RunContext ctx) {
        TimeWindows w = ctx.timeWindows();
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("analysisWindow", w.window().name().toLowerCase(Locale.ROOT));
        out.put("analysisStart",  w.analysisStart().toString());
        out.put("analysisEnd",    w.analysisEnd().toString());
        out.put("previousStart",  w.previousStart().toString());
        out.put("previousEnd",    w.previousEnd().toString());
        return out;
    }
}
