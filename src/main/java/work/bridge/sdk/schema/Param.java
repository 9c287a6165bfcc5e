package work.bridge.sdk.schema;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Optional per-parameter declaration: name override, default value and field-level constraints.
 * <p>
 * Constraints are merged into the derived property schema and enforced when a step is invoked.
 * {@link #defaultValue()} is parsed as a JSON literal, except for string parameters where the raw
 * text is the default.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.PARAMETER)
public @interface Param {
    String UNSET = "\u0000unset";

    String name() default "";

    String defaultValue() default UNSET;

    String description() default "";

    double minimum() default Double.NaN;

    double maximum() default Double.NaN;

    int minLength() default -1;

    int maxLength() default -1;

    String pattern() default "";
}
