package com.convkit.http;

import com.convkit.shared.error.EncodingException;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A path such as {@code /v1/workspaces/{workspace_id}/intents/{intent}}. Expansion
 * percent-encodes every value as a single segment, so values may contain {@code /}. The values
 * {@code .} and {@code ..} are rejected.
 */
public final class PathTemplate {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([A-Za-z0-9_]+)}");

    private final String template;
    private final List<String> parameterNames;

    private PathTemplate(String template) {
        this.template = template;
        var names = new ArrayList<String>();
        var m = PLACEHOLDER.matcher(template);
        while (m.find()) names.add(m.group(1));
        this.parameterNames = List.copyOf(names);
    }

    public static PathTemplate of(String template) {
        if (!template.startsWith("/")) {
            throw new IllegalArgumentException("Path template must start with '/': " + template);
        }
        return new PathTemplate(template);
    }

    public String template() { return template; }

    public List<String> parameterNames() { return parameterNames; }

    /** Substitutes values in placeholder order. */
    public String expand(String... values) {
        if (values.length != parameterNames.size()) {
            throw new IllegalArgumentException("Path " + template + " takes " + parameterNames.size()
                    + " parameters, got " + values.length);
        }
        var m = PLACEHOLDER.matcher(template);
        var sb = new StringBuilder();
        int i = 0;
        while (m.find()) {
            var value = values[i];
            if (value == null || value.isEmpty()) {
                throw new EncodingException("Path parameter '" + parameterNames.get(i) + "' has no value");
            }
            // servers and proxies resolve dot segments even when percent-encoded
            if (value.equals(".") || value.equals("..")) {
                throw new EncodingException("Path parameter '" + parameterNames.get(i) + "' cannot be a dot segment");
            }
            String encoded;
            try {
                encoded = UriEncoding.encodePathSegment(value);
            } catch (EncodingException e) {
                throw new EncodingException("Path parameter '" + parameterNames.get(i) + "' cannot be encoded", e);
            }
            m.appendReplacement(sb, Matcher.quoteReplacement(encoded));
            i++;
        }
        m.appendTail(sb);
        return sb.toString();
    }

    @Override
    public String toString() {
        return template;
    }
}
