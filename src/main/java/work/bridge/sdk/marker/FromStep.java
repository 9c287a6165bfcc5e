package work.bridge.sdk.marker;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Repeatable;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares that a parameter is fed by the result of another step, named by its effective name.
 * <p>
 * When several markers are present on one parameter only the first, in declaration order, is used.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.PARAMETER)
@Repeatable(FromStep.List.class)
public @interface FromStep {
    String value();

    @Documented
    @Retention(RetentionPolicy.RUNTIME)
    @Target(ElementType.PARAMETER)
    @interface List {
        FromStep[] value();
    }
}
