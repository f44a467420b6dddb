package com.flowgraph.engine.task;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flowgraph.annotations.TaskFunction;
import com.flowgraph.annotations.TaskInput;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.Parameter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Task body backed by a plain Java method. Parameter names come from {@link TaskInput} or, without
 * it, from the compiled names (the module must be compiled with {@code -parameters}). Arguments
 * whose runtime type does not match the parameter type are converted with Jackson, so an
 * {@code Integer} from the context binds to a {@code double} parameter and a JSON-like
 * {@code Map} binds to a bean.
 */
public final class MethodTaskBody implements TaskBody {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Object target;
    private final Method method;
    private final List<TaskParameter> parameters;
    private final List<JavaType> parameterTypes;
    private final String description;

    private MethodTaskBody(Object target, Method method) {
        this.target = target;
        this.method = method;
        if (!Modifier.isPublic(method.getModifiers()) || !Modifier.isPublic(method.getDeclaringClass().getModifiers())) {
            method.setAccessible(true);
        }
        List<TaskParameter> params = new ArrayList<>();
        List<JavaType> types = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (Parameter p : method.getParameters()) {
            JavaType type = MAPPER.constructType(p.getParameterizedType());
            TaskParameter param = describe(p, type);
            if (!seen.add(param.name())) {
                throw new IllegalArgumentException("Duplicate parameter name " + param.name() + " on " + method);
            }
            params.add(param);
            types.add(type);
        }
        this.parameters = Collections.unmodifiableList(params);
        this.parameterTypes = Collections.unmodifiableList(types);
        TaskFunction ann = method.getAnnotation(TaskFunction.class);
        this.description = ann != null ? ann.description() : "";
    }

    /** Instance method {@code methodName} on {@code target}; exactly one method may carry that name. */
    public static MethodTaskBody of(Object target, String methodName) {
        Objects.requireNonNull(target, "target");
        return new MethodTaskBody(target, findByName(target.getClass(), methodName, false));
    }

    /** Static method {@code methodName} declared on {@code type}. */
    public static MethodTaskBody ofStatic(Class<?> type, String methodName) {
        Objects.requireNonNull(type, "type");
        return new MethodTaskBody(null, findByName(type, methodName, true));
    }

    /**
     * Method annotated with {@link TaskFunction} whose key ({@link TaskFunction#value()}, or the
     * method name when empty) equals {@code key}. Static methods are allowed; {@code target} may
     * then be a {@link Class}.
     */
    public static MethodTaskBody annotated(Object target, String key) {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(key, "key");
        Class<?> type = target instanceof Class<?> c ? c : target.getClass();
        for (Method m : type.getDeclaredMethods()) {
            TaskFunction ann = m.getAnnotation(TaskFunction.class);
            if (ann == null) continue;
            String k = ann.value().isEmpty() ? m.getName() : ann.value();
            if (!k.equals(key)) continue;
            boolean isStatic = Modifier.isStatic(m.getModifiers());
            if (!isStatic && target instanceof Class<?>) {
                throw new IllegalArgumentException("Task function " + key + " is an instance method; pass an instance of " + type.getName());
            }
            return new MethodTaskBody(isStatic ? null : target, m);
        }
        throw new IllegalArgumentException("No @TaskFunction named " + key + " on " + type.getName());
    }

    private static Method findByName(Class<?> type, String methodName, boolean wantStatic) {
        Objects.requireNonNull(methodName, "methodName");
        Method found = null;
        for (Method m : type.getDeclaredMethods()) {
            if (!m.getName().equals(methodName) || m.isSynthetic()) continue;
            if (Modifier.isStatic(m.getModifiers()) != wantStatic) continue;
            if (found != null) {
                throw new IllegalArgumentException("Method name is overloaded, cannot bind by name: " + type.getName() + "#" + methodName);
            }
            found = m;
        }
        if (found == null) {
            throw new IllegalArgumentException("No " + (wantStatic ? "static" : "instance") + " method " + methodName + " on " + type.getName());
        }
        return found;
    }

    private static TaskParameter describe(Parameter p, JavaType type) {
        TaskInput input = p.getAnnotation(TaskInput.class);
        String name = input != null && !input.value().isEmpty() ? input.value() : null;
        if (name == null) {
            if (!p.isNamePresent()) {
                throw new IllegalArgumentException("Parameter names are not available for " + p.getDeclaringExecutable()
                        + "; compile with -parameters or annotate parameters with @TaskInput");
            }
            name = p.getName();
        }
        if (input == null || TaskInput.NO_DEFAULT.equals(input.defaultValue())) {
            return TaskParameter.required(name);
        }
        return TaskParameter.optional(name, parseDefault(name, input.defaultValue(), type));
    }

    private static Object parseDefault(String name, String raw, JavaType type) {
        if (type.hasRawClass(String.class) || type.hasRawClass(Object.class)) {
            return raw;
        }
        try {
            return MAPPER.readValue(raw, type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Default value for " + name + " is not a valid " + type + ": " + raw, e);
        }
    }

    @Override
    public List<TaskParameter> parameters() {
        return parameters;
    }

    @Override
    public Object invoke(Map<String, Object> arguments) throws Exception {
        Object[] args = new Object[parameters.size()];
        for (int i = 0; i < args.length; i++) {
            Object raw = arguments != null ? arguments.get(parameters.get(i).name()) : null;
            args[i] = coerce(raw, parameterTypes.get(i));
        }
        try {
            return method.invoke(target, args);
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception ex) throw ex;
            if (cause instanceof Error err) throw err;
            throw e;
        }
    }

    private static Object coerce(Object value, JavaType type) {
        Class<?> raw = type.getRawClass();
        if (value == null) {
            if (raw.isPrimitive()) {
                throw new IllegalArgumentException("null cannot be bound to primitive parameter of type " + raw.getName());
            }
            return null;
        }
        Class<?> boxed = raw.isPrimitive() ? box(raw) : raw;
        // element types of generic containers are not re-checked
        if (boxed.isInstance(value)) {
            return value;
        }
        return MAPPER.convertValue(value, type);
    }

    private static Class<?> box(Class<?> primitive) {
        if (primitive == int.class) return Integer.class;
        if (primitive == long.class) return Long.class;
        if (primitive == double.class) return Double.class;
        if (primitive == float.class) return Float.class;
        if (primitive == boolean.class) return Boolean.class;
        if (primitive == short.class) return Short.class;
        if (primitive == byte.class) return Byte.class;
        if (primitive == char.class) return Character.class;
        return primitive;
    }

    public Method getMethod() {
        return method;
    }

    @Override
    public String description() {
        return description;
    }

    @Override
    public String toString() {
        return "MethodTaskBody[" + method.getDeclaringClass().getSimpleName() + "#" + method.getName() + "]";
    }
}
