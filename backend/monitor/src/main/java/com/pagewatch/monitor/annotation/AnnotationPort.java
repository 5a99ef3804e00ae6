package com.pagewatch.monitor.annotation;

import com.pagewatch.core.model.Annotation;
import com.pagewatch.core.model.ChangeRecord;
import com.pagewatch.monitor.api.Annotator;

import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Best-effort enrichment bound to the credential a job was started with. Failures never
 * propagate; the record is simply left unannotated.
 */
public final class AnnotationPort {
    private static final Logger LOGGER = Logger.getLogger(AnnotationPort.class.getName());
    private static final AnnotationPort DISABLED = new AnnotationPort(null, null);

    private final Annotator annotator;
    private final String credential;

    private AnnotationPort(Annotator annotator, String credential) {
        this.annotator = annotator;
        this.credential = credential;
    }

    public static AnnotationPort disabled() {
        return DISABLED;
    }

    public static AnnotationPort forCredential(Annotator annotator, String credential) {
        if (credential == null || credential.isBlank()) {
            return DISABLED;
        }
        return new AnnotationPort(Objects.requireNonNull(annotator, "annotator is required"), credential.trim());
    }

    public boolean enabled() {
        return annotator != null;
    }

    public Optional<Annotation> annotate(ChangeRecord record) {
        if (annotator == null) {
            return Optional.empty();
        }
        try {
            return annotator.annotate(record, credential);
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Annotation unavailable for " + record.type().tag() + " record", e);
            return Optional.empty();
        }
    }
}
