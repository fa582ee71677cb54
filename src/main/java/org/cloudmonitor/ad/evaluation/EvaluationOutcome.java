/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.cloudmonitor.ad.evaluation;

import java.util.Locale;

/**
 * Confusion matrix cell of one prediction.
 */
public enum EvaluationOutcome {
    TRUE_POSITIVE,
    FALSE_POSITIVE,
    TRUE_NEGATIVE,
    FALSE_NEGATIVE;

    public static EvaluationOutcome of(boolean predictedAnomaly, boolean actualAnomaly) {
        if (predictedAnomaly) {
            return actualAnomaly ? TRUE_POSITIVE : FALSE_POSITIVE;
        }
        return actualAnomaly ? FALSE_NEGATIVE : TRUE_NEGATIVE;
    }

    public String getName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
