package works.polyfail.junit;

import java.lang.annotation.Retention;
import java.lang.annotation.Target;
import org.junit.jupiter.api.Tag;

import static java.lang.annotation.ElementType.METHOD;
import static java.lang.annotation.ElementType.TYPE;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Marks property tests that run many generated cases,
 * so a quick run can exclude them with the {@code slow} tag.
 */
@Target({METHOD, TYPE})
@Retention(RUNTIME)
@Tag("slow")
public @interface Slow {
}
