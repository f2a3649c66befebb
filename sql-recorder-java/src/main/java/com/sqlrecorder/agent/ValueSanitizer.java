package com.sqlrecorder.agent;

import java.lang.reflect.Array;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.*;

/**
 * Turns captured request data into values Gson can always write.
 *
 * Rules:
 * - null stays null
 * - String, Boolean and JDK numbers are kept; enums become their name; other java.* types their toString()
 * - Maps become String-keyed maps; arrays and collections become lists of up to maxCollectionElements
 *   entries, followed by a "<+N more>" marker when truncated
 * - POJOs become a map of their declared (and inherited) non-static fields
 * - Depth limit: when current depth >= depthLimit, emit "<TypeName>" instead of recursing
 * - Cycle detection: via IdentityHashMap, emit "<circular>" if re-visited
 */
public final class ValueSanitizer {

    private ValueSanitizer() {}

    /** Sanitizes every value of {@code map}; keys are converted with String.valueOf. */
    public static Map<String, Object> sanitizeMap(Map<?, ?> map, RecorderConfig config) {
        Map<String, Object> result = new LinkedHashMap<>();
        if (map == null) return result;
        IdentityHashMap<Object, Boolean> visited = new IdentityHashMap<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            result.put(String.valueOf(entry.getKey()), sanitizeInto(entry.getValue(), config, 0, visited));
        }
        return result;
    }

    public static Object sanitize(Object value, RecorderConfig config) {
        return sanitizeInto(value, config, 0, new IdentityHashMap<>());
    }

    private static Object sanitizeInto(
            Object obj,
            RecorderConfig config,
            int depth,
            IdentityHashMap<Object, Boolean> visited) {

        if (obj == null) return null;

        Class<?> cls = obj.getClass();
        if (isScalar(cls)) return obj;
        if (cls.isEnum()) return ((Enum<?>) obj).name();
        if (obj instanceof Character || obj instanceof CharSequence) return obj.toString();

        if (visited.containsKey(obj)) return "<circular>";
        if (depth >= config.depthLimit()) return "<" + cls.getSimpleName() + ">";

        visited.put(obj, Boolean.TRUE);
        try {
            if (cls.isArray()) {
                List<Object> elements = new ArrayList<>();
                int len = Array.getLength(obj);
                for (int i = 0; i < len; i++) elements.add(Array.get(obj, i));
                return sanitizeElements(elements, config, depth, visited);
            }
            if (obj instanceof Collection<?> col) {
                return sanitizeElements(col, config, depth, visited);
            }
            if (obj instanceof Map<?, ?> map) {
                Map<String, Object> out = new LinkedHashMap<>();
                for (Map.Entry<?, ?> entry : map.entrySet()) {
                    out.put(String.valueOf(entry.getKey()),
                        sanitizeInto(entry.getValue(), config, depth + 1, visited));
                }
                return out;
            }
            // JDK value types (dates, UUIDs, paths...) are not walked reflectively
            if (cls.getName().startsWith("java.") || cls.getName().startsWith("javax.")) {
                return String.valueOf(obj);
            }
            return sanitizePojo(obj, cls, config, depth, visited);
        } finally {
            visited.remove(obj);
        }
    }

    private static List<Object> sanitizeElements(
            Collection<?> col,
            RecorderConfig config,
            int depth,
            IdentityHashMap<Object, Boolean> visited) {

        List<Object> out = new ArrayList<>();
        int count = 0;
        for (Object elem : col) {
            if (count >= config.maxCollectionElements()) break;
            out.add(sanitizeInto(elem, config, depth + 1, visited));
            count++;
        }
        if (col.size() > count) {
            out.add("<+" + (col.size() - count) + " more>");
        }
        return out;
    }

    private static Map<String, Object> sanitizePojo(
            Object obj,
            Class<?> cls,
            RecorderConfig config,
            int depth,
            IdentityHashMap<Object, Boolean> visited) {

        Map<String, Object> out = new LinkedHashMap<>();
        Class<?> c = cls;
        while (c != null && c != Object.class) {
            for (Field field : c.getDeclaredFields()) {
                if (field.isSynthetic() || Modifier.isStatic(field.getModifiers())) continue;
                if (out.containsKey(field.getName())) continue;
                try {
                    field.setAccessible(true);
                    out.put(field.getName(), sanitizeInto(field.get(obj), config, depth + 1, visited));
                } catch (RuntimeException | IllegalAccessException e) {
                    // setAccessible is refused for module-protected fields
                    out.put(field.getName(), "<inaccessible>");
                }
            }
            c = c.getSuperclass();
        }
        return out;
    }

    static boolean isScalar(Class<?> cls) {
        return cls == String.class
            || cls == Boolean.class
            || Number.class.isAssignableFrom(cls)
                && ("java.lang".equals(cls.getPackageName()) || "java.math".equals(cls.getPackageName()));
    }
}
