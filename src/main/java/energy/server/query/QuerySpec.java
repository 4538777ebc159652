package energy.server.query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Query text with its positional parameters. Parameters are always bound by
 * the driver and never spliced into the text.
 */
public class QuerySpec {

    private final String text;
    private final List<Object> params;

    public QuerySpec(String text, List<Object> params) {
        this.text = text;
        this.params = Collections.unmodifiableList(new ArrayList<>(params));
    }

    public static QuerySpec of(String text, Object... params) {
        List<Object> list = new ArrayList<>();
        Collections.addAll(list, params);
        return new QuerySpec(text, list);
    }

    public String getText() {
        return text;
    }

    public List<Object> getParams() {
        return params;
    }

    /**
     * True when the trimmed text starts with SELECT, ignoring case.
     */
    public boolean isReadOnly() {
        return text != null && text.trim().toUpperCase(Locale.ROOT).startsWith("SELECT");
    }

    @Override
    public String toString() {
        return "QuerySpec{text='" + text.trim().replaceAll("\\s+", " ") + "', params=" + params + "}";
    }
}
