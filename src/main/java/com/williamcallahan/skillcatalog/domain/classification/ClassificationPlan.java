package com.williamcallahan.skillcatalog.domain.classification;

import com.williamcallahan.skillcatalog.domain.ClassificationMethod;
import java.util.Objects;

/**
 * Classification method chosen by the admission policy for one record.
 *
 * <p>A closed set of variants: a direct front-matter match already carries its result, the
 * other two name the method that still has to run.</p>
 */
public sealed interface ClassificationPlan {

    ClassificationMethod method();

    static ClassificationPlan direct(ClassificationResult result) {
        return new Direct(result);
    }

    static ClassificationPlan keyword() {
        return new Keyword();
    }

    static ClassificationPlan ai() {
        return new Ai();
    }

    /** Front-matter categories matched the vocabulary. */
    record Direct(ClassificationResult result) implements ClassificationPlan {
        public Direct {
            Objects.requireNonNull(result, "result");
        }

        @Override
        public ClassificationMethod method() {
            return ClassificationMethod.DIRECT;
        }
    }

    /** Score vocabulary keywords against the marker content. */
    record Keyword() implements ClassificationPlan {
        @Override
        public ClassificationMethod method() {
            return ClassificationMethod.KEYWORD;
        }
    }

    /** Run the AI fallback chain, ending in keyword classification. */
    record Ai() implements ClassificationPlan {
        @Override
        public ClassificationMethod method() {
            return ClassificationMethod.AI;
        }
    }
}
