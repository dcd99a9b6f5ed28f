package com.hookrelay.service;

import com.hookrelay.exception.HookRejectedException;
import com.hookrelay.model.DispatchReport;
import com.hookrelay.model.HookOutcome;
import org.springframework.stereotype.Component;

/**
 * Turns the end state of the pipeline into what the caller sees.
 *
 *   skipped              → accepted, "Acknowledged, but skipping. Reason: ..."
 *   rejected early       → the exception's errors
 *   dispatch had errors  → every error of the batch
 *   dispatch all good    → "Successfully triggered N build(s)."
 */
@Component
public class OutcomeComposer {

    public HookOutcome skipped(String reason) {
        return HookOutcome.accepted("Acknowledged, but skipping. Reason: " + reason);
    }

    public HookOutcome rejected(HookRejectedException e) {
        return HookOutcome.rejected(e.getErrors());
    }

    public HookOutcome dispatched(DispatchReport report) {
        if (!report.isSuccess()) {
            return HookOutcome.rejected(report.errors());
        }
        return HookOutcome.accepted(successMessage(report.getAttempted()));
    }

    static String successMessage(int triggered) {
        if (triggered == 1) {
            return "Successfully triggered 1 build.";
        }
        return "Successfully triggered " + triggered + " builds.";
    }
}
