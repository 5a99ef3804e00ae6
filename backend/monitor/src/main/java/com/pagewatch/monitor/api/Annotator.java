package com.pagewatch.monitor.api;

import com.pagewatch.core.model.Annotation;
import com.pagewatch.core.model.ChangeRecord;

import java.util.Optional;

public interface Annotator {
    /**
     * Classifies a change record. Returns empty when the record carries nothing worth classifying
     * and throws when the classifier cannot be reached or answers with something unusable.
     */
    Optional<Annotation> annotate(ChangeRecord record, String credential);
}
