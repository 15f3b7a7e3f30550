package io.brickmux.process;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import com.github.mustachejava.Binding;
import com.github.mustachejava.Code;
import com.github.mustachejava.DefaultMustacheFactory;
import com.github.mustachejava.MustacheException;
import com.github.mustachejava.ObjectHandler;
import com.github.mustachejava.TemplateContext;
import com.github.mustachejava.codes.ValueCode;
import com.github.mustachejava.reflect.GuardedBinding;
import com.github.mustachejava.reflect.MissingWrapper;
import com.github.mustachejava.reflect.ReflectionObjectHandler;
import com.github.mustachejava.util.Wrapper;

/**
 * Utility methods relating to rendering mustache templates for process command lines. Values are inserted as-is,
 * without HTML escaping.
 */
public class TemplateUtils {

    private TemplateUtils() {
        // do not instantiate
    }

    /**
     * Renders a given Mustache template using the provided value map, throwing an exception if any template parameters
     * weren't found in the map.
     *
     * @param templateName name of the template, for error messages
     * @param templateContent String representation of template
     * @param values Map of values to be inserted into the template
     * @return Rendered Mustache template String
     * @throws MustacheException if parameters in the {@code templateContent} weren't provided in the {@code values}
     */
    public static String renderMustacheThrowIfMissing(
            String templateName, String templateContent, Map<String, String> values) throws MustacheException {
        List<String> missingValues = new ArrayList<>();
        StringWriter writer = new StringWriter();
        DefaultMustacheFactory mustacheFactory = new DefaultMustacheFactory() {
            @Override
            public void encode(String value, Writer out) {
                try {
                    out.write(value);
                } catch (IOException e) {
                    throw new MustacheException("Failed to write value", e);
                }
            }
        };
        mustacheFactory.setObjectHandler(new ReflectionObjectHandler() {
            @Override
            public Binding createBinding(String name, final TemplateContext tc, Code code) {
                return new MissingValueBinding(this, name, tc, code, missingValues);
            }
        });
        mustacheFactory
                .compile(new StringReader(templateContent), templateName)
                .execute(writer, new TreeMap<String, Object>(values));
        if (!missingValues.isEmpty()) {
            throw new MustacheException(String.format(
                    "Missing %d value%s when rendering %s:%n- Missing values: %s%n- Provided values: %s",
                    missingValues.size(),
                    missingValues.size() == 1 ? "" : "s",
                    templateName,
                    missingValues,
                    new TreeMap<>(values)));
        }
        return writer.toString();
    }

    /**
     * An extension of {@link GuardedBinding} which collects missing values against the provided list.
     */
    private static class MissingValueBinding extends GuardedBinding {

        private final TemplateContext tc;
        private final Code code;
        private final List<String> missingValues;

        private MissingValueBinding(
                ObjectHandler oh,
                String name,
                final TemplateContext tc,
                Code code,
                List<String> missingValues) {
            super(oh, name, tc, code);
            this.tc = tc;
            this.code = code;
            this.missingValues = missingValues;
        }

        @Override
        protected synchronized Wrapper getWrapper(String name, List<Object> scopes) {
            Wrapper wrapper = super.getWrapper(name, scopes);
            // Only plain "{{value}}" params count: "{{#value}}...{{/value}}" sections may be unset on purpose.
            if (code instanceof ValueCode && wrapper instanceof MissingWrapper) {
                missingValues.add(String.format("%s@L%d", name, tc.line()));
            }
            return wrapper;
        }
    }
}
