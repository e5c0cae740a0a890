package com.arbiter.core.nodes;

import com.arbiter.core.model.CoordinationPhase;
import com.arbiter.core.state.CoordinationState;
import com.arbiter.core.value.ActionValidation;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Turns alignment warnings into a refinement instruction that lists each
 * warning verbatim, one per line.
 */
@Component
public class RefineNode {

    static final String HEADER = "Please refine the result to address:\n";

    public Map<String, Object> apply(CoordinationState state) {
        List<String> warnings = state.validation().map(ActionValidation::warnings).orElse(List.of());
        return Map.of(
                "shouldRefine", true,
                "refinementInstruction", buildInstruction(warnings),
                "phase", CoordinationPhase.REFINE.name(),
                "coordinationLog", List.of("Refinement required: " + warnings.size() + " warning(s) to address")
        );
    }

    static String buildInstruction(List<String> warnings) {
        var instruction = new StringBuilder(HEADER);
        for (String warning : warnings) {
            instruction.append("- ").append(warning).append('\n');
        }
        return instruction.toString();
    }
}
