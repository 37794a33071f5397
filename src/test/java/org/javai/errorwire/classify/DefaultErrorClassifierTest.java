package org.javai.errorwire.classify;

import org.javai.errorwire.AppError;
import org.javai.errorwire.AppErrors;
import org.javai.errorwire.ClassifiedError;
import org.javai.errorwire.ErrorWireConfig;
import org.javai.errorwire.classify.SampleErrors.BlankNameException;
import org.javai.errorwire.classify.SampleErrors.OrderMissingException;
import org.javai.errorwire.classify.SampleErrors.QuotaExceededException;
import org.javai.errorwire.classify.SampleErrors.TeapotException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class DefaultErrorClassifierTest {

    public static class EnclosedError extends RuntimeException {
        public EnclosedError(String message) {
            super(message);
        }
    }

    private static class hiddenError extends RuntimeException {
        hiddenError(String message) {
            super(message);
        }
    }

    private static class HiddenError extends RuntimeException {
        HiddenError(String message) {
            super(message);
        }
    }

    private DefaultErrorClassifier classifier;
    private DefaultErrorClassifier snakeCaseClassifier;

    @BeforeEach
    void setUp() {
        classifier = new DefaultErrorClassifier(ErrorWireConfig.defaults());
        snakeCaseClassifier = new DefaultErrorClassifier(
                ErrorWireConfig.builder().snakeCaseHttpEquivErrors(true).build());
    }

    @Test
    void noCapabilities_nonPublicType_usesFallbackNameAndStatus500() {
        ClassifiedError classified = classifier.classify(new HiddenError("boom"));

        assertThat(classified.typeName()).isEqualTo("error");
        assertThat(classified.httpStatus()).isEqualTo(500);
        assertThat(classified.code()).isZero();
        assertThat(classified.description()).isEqualTo("boom");
    }

    @Test
    void noCapabilities_lowercaseTypeName_usesFallbackName() {
        ClassifiedError classified = snakeCaseClassifier.classify(new hiddenError("boom"));

        assertThat(classified.typeName()).isEqualTo("error");
        assertThat(classified.httpStatus()).isEqualTo(500);
    }

    @Test
    void noCapabilities_anonymousType_usesFallbackName() {
        RuntimeException anonymous = new RuntimeException("anon") {};

        assertThat(classifier.classify(anonymous).typeName()).isEqualTo("error");
    }

    @Test
    void noCapabilities_publicTypeInsideNonPublicClass_usesFallbackName() {
        assertThat(classifier.classify(new EnclosedError("boom")).typeName()).isEqualTo("error");
    }

    @Test
    void noCapabilities_publicType_usesQualifiedClassName() {
        ClassifiedError classified = classifier.classify(new IllegalStateException("bad state"));

        assertThat(classified.typeName()).isEqualTo("java.lang.IllegalStateException");
        assertThat(classified.httpStatus()).isEqualTo(500);
        assertThat(classified.description()).isEqualTo("bad state");
    }

    @Test
    void nullMessage_yieldsEmptyDescription() {
        ClassifiedError classified = classifier.classify(new IllegalStateException());

        assertThat(classified.description()).isEmpty();
    }

    @Test
    void named_usesNameVerbatimRegardlessOfSnakeCaseFlag() {
        QuotaExceededException error = new QuotaExceededException();

        assertThat(classifier.classify(error).typeName()).isEqualTo("quota_exceeded");
        assertThat(snakeCaseClassifier.classify(error).typeName()).isEqualTo("quota_exceeded");
        assertThat(classifier.classify(error).httpStatus()).isEqualTo(429);
    }

    @Test
    void named_withBlankName_fallsThroughToTypeName() {
        ClassifiedError classified = classifier.classify(new BlankNameException());

        assertThat(classified.typeName())
                .isEqualTo("org.javai.errorwire.classify.SampleErrors.BlankNameException");
    }

    @Test
    void httpStatusEquivalent_withSnakeCase_usesReasonPhrase() {
        ClassifiedError classified = snakeCaseClassifier.classify(new OrderMissingException("order 7"));

        assertThat(classified.typeName()).isEqualTo("not_found");
        assertThat(classified.httpStatus()).isEqualTo(404);
        assertThat(classified.description()).isEqualTo("order 7");
    }

    @Test
    void httpStatusEquivalent_withoutSnakeCase_usesQualifiedClassName() {
        ClassifiedError classified = classifier.classify(new OrderMissingException("order 7"));

        assertThat(classified.typeName())
                .isEqualTo("org.javai.errorwire.classify.SampleErrors.OrderMissingException");
        assertThat(classified.httpStatus()).isEqualTo(404);
    }

    @Test
    void httpStatusEquivalent_invalidStatus_fallsBackTo500() {
        ClassifiedError classified = snakeCaseClassifier.classify(new TeapotException(42));

        assertThat(classified.httpStatus()).isEqualTo(500);
        assertThat(classified.typeName())
                .isEqualTo("org.javai.errorwire.classify.SampleErrors.TeapotException");
    }

    @Test
    void appError_rendersExplicitFields() {
        ClassifiedError classified = classifier.classify(AppErrors.jsonError("unexpected token"));

        assertThat(classified.typeName()).isEqualTo("json");
        assertThat(classified.code()).isEqualTo(9001);
        assertThat(classified.description()).isEqualTo("unexpected token");
        assertThat(classified.httpStatus()).isEqualTo(400);
    }

    @Test
    void appError_withoutStatus_defaultsTo500() {
        ClassifiedError classified = classifier.classify(AppErrors.of(42, "billing", "card declined"));

        assertThat(classified.httpStatus()).isEqualTo(500);
        assertThat(classified.code()).isEqualTo(42);
    }

    @Test
    void appError_withoutType_namedFromStatusWhenSnakeCase() {
        AppError notFound = AppErrors.methodNotFound("GET /orders not found");

        assertThat(snakeCaseClassifier.classify(notFound).typeName()).isEqualTo("not_found");
        assertThat(classifier.classify(notFound).typeName()).isEqualTo("org.javai.errorwire.AppError");
    }

    @Test
    void classifyName_usesGivenFallback() {
        assertThat(classifier.classifyName(new HiddenError("x"), "unexpected")).isEqualTo("unexpected");
    }

    @Test
    void configuredFallbackName_isUsedByClassify() {
        DefaultErrorClassifier custom = new DefaultErrorClassifier(
                ErrorWireConfig.builder().fallbackErrorName("internal").build());

        assertThat(custom.classify(new HiddenError("x")).typeName()).isEqualTo("internal");
    }

    @Test
    void nullError_isRejected() {
        assertThatThrownBy(() -> classifier.classify(null))
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("error");
    }
}
