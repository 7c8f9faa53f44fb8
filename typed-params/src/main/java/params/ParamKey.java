package params;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Name of the params document member a record component is read from, when it differs from
 * the component name.
 *
 * <pre>{@code
 * record RowNames(@ParamKey("TOTAL_ROW") String totalRow, @ParamKey("QUESTION_ROW") String questionRow) {}
 * }</pre>
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.RECORD_COMPONENT)
public @interface ParamKey {
    String value();
}
