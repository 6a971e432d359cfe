/*
 * Copyright 2025 Justin Marsh
 * SPDX-License-Identifier: Apache-2.0
 */

package com.example.scopelog.agent;

import com.example.scopelog.ScopeLog;
import com.example.scopelog.api.trace.Traced;
import net.bytebuddy.agent.builder.AgentBuilder;
import net.bytebuddy.asm.Advice;
import net.bytebuddy.description.annotation.AnnotationDescription;
import net.bytebuddy.description.method.MethodDescription;
import net.bytebuddy.description.type.TypeDescription;
import net.bytebuddy.dynamic.DynamicType;
import net.bytebuddy.matcher.ElementMatcher;
import net.bytebuddy.utility.JavaModule;

import java.lang.instrument.Instrumentation;
import java.util.HashSet;
import java.util.Set;

import static net.bytebuddy.matcher.ElementMatchers.*;

/**
 * Java Agent for automatic scope tracing.
 * Wraps selected methods in a ScopeTracer so their entry and exit land in the
 * diagnostics log without touching the method bodies.
 *
 * <p>Usage:
 * <pre>
 * java -javaagent:scopelog-core-agent.jar=include=com.acme.*;exclude=com.acme.generated.* -jar app.jar
 * </pre>
 */
public class ScopeTraceAgent {

    /**
     * Premain method for Java agent
     *
     * @param arguments Agent arguments in format: include=pkg1,pkg2;exclude=pkg3,pkg4;annotatedOnly=true
     * @param inst Instrumentation instance
     */
    public static void premain(String arguments, Instrumentation inst) {
        AgentConfig config = AgentConfig.parse(arguments);

        System.out.println("[ScopeTraceAgent] Starting with config: " + config);

        ScopeTraceAdvice.bind(ScopeLog.diagnostics());

        // Opening the diagnostics file now puts any crash point ahead of the first traced call
        if (ScopeLog.diagnostics().isCrashedLastRun()) {
            System.out.println("[ScopeTraceAgent] Previous run ended inside an open scope; crash point recorded in " +
                ScopeLog.config().getDiagnosticsFile());
        }

        setupJmxMonitoring();
        ScopeLog.installShutdownHook();

        new AgentBuilder.Default()
            .with(AgentBuilder.RedefinitionStrategy.RETRANSFORMATION)
            .with(new AgentBuilder.Listener.StreamWriting(System.out).withTransformationsOnly())
            .ignore(
                nameStartsWith("net.bytebuddy.")
                .or(nameStartsWith("java."))
                .or(nameStartsWith("sun."))
                .or(nameStartsWith("com.sun."))
                .or(nameStartsWith("jdk."))
                .or(nameStartsWith("org.mockito.")) // Avoid conflicts with Mockito mocking framework
                // Never trace the tracer
                .or(nameStartsWith("com.example.scopelog."))
                .or(isSynthetic()) // Don't instrument compiler-generated classes
            )
            .type(config.getTypeMatcher()
                .and(not(isInterface()))
                .and(not(isAnnotation())))
            .transform(new ScopeTraceTransformer(config.isAnnotatedOnly()))
            .installOn(inst);

        System.out.println("[ScopeTraceAgent] Instrumentation installed successfully");
    }

    /**
     * Transformer that wraps each eligible declared method with its own
     * ScopeTraceAdvice, binding the method's label and source file as constants.
     */
    static class ScopeTraceTransformer implements AgentBuilder.Transformer {
        private final boolean annotatedOnly;

        ScopeTraceTransformer(boolean annotatedOnly) {
            this.annotatedOnly = annotatedOnly;
        }

        @Override
        public DynamicType.Builder<?> transform(
                DynamicType.Builder<?> builder,
                TypeDescription typeDescription,
                ClassLoader classLoader,
                JavaModule module,
                java.security.ProtectionDomain protectionDomain) {

            for (MethodDescription method : typeDescription.getDeclaredMethods()) {
                if (!isTraceable(method, annotatedOnly)) {
                    continue;
                }
                builder = builder.visit(adviceFor(typeDescription, method).on(is(method)));
            }
            return builder;
        }
    }

    /**
     * Constructors are skipped: exit advice with onThrowable cannot wrap the
     * super() call, and object construction is rarely the scope of interest.
     */
    static boolean isTraceable(MethodDescription method, boolean annotatedOnly) {
        if (method.isConstructor() || method.isTypeInitializer() || method.isAbstract() ||
            method.isNative() || method.isSynthetic() || method.isBridge()) {
            return false;
        }
        if (annotatedOnly) {
            return method.getDeclaredAnnotations().isAnnotationPresent(Traced.class);
        }
        return true;
    }

    /**
     * Advice for one method with its label and source file bound as constants.
     */
    static Advice adviceFor(TypeDescription type, MethodDescription method) {
        return Advice.withCustomMapping()
            .bind(ScopeTraceAdvice.Label.class, labelFor(type, method))
            .bind(ScopeTraceAdvice.SourceFile.class, sourceFileFor(type.getName()))
            .to(ScopeTraceAdvice.class);
    }

    /**
     * {@code Outer$Inner.method}, plus {@code :name} for {@code @Traced("name")}.
     */
    static String labelFor(TypeDescription type, MethodDescription method) {
        String label = toSimpleName(type.getName()) + "." + method.getName();
        String name = tracedName(method);
        return name.isEmpty() ? label : label + ":" + name;
    }

    private static String tracedName(MethodDescription method) {
        AnnotationDescription.Loadable<Traced> traced = method.getDeclaredAnnotations().ofType(Traced.class);
        if (traced == null) {
            return "";
        }
        try {
            return traced.load().value();
        } catch (Exception e) {
            System.err.println("[ScopeTraceAgent] Could not read @Traced on " + method + ": " + e);
            return "";
        }
    }

    /**
     * Strip the package: {@code com.example.Outer$Inner} becomes {@code Outer$Inner}.
     */
    static String toSimpleName(String className) {
        int lastDot = className.lastIndexOf('.');
        return lastDot < 0 ? className : className.substring(lastDot + 1);
    }

    /**
     * Source file of a class by Java naming convention: nested classes live in
     * their top-level class's file.
     */
    static String sourceFileFor(String className) {
        String simple = toSimpleName(className);
        int dollar = simple.indexOf('$');
        if (dollar > 0) {
            simple = simple.substring(0, dollar);
        }
        return simple + ".java";
    }

    /**
     * Setup JMX MBean for runtime monitoring
     */
    private static void setupJmxMonitoring() {
        try {
            javax.management.MBeanServer mbs =
                java.lang.management.ManagementFactory.getPlatformMBeanServer();
            javax.management.ObjectName name =
                new javax.management.ObjectName("com.example:type=ScopeLog");
            mbs.registerMBean(new ScopeLogStatus(ScopeLog.messages(), ScopeLog.diagnostics()), name);
            System.out.println("[ScopeTraceAgent] JMX MBean registered");
        } catch (Exception e) {
            System.err.println("[ScopeTraceAgent] Failed to register JMX MBean: " + e);
        }
    }
}

/**
 * Configuration for the agent
 */
class AgentConfig {
    /** Suffix for package wildcard notation (e.g., "com.example.*") */
    private static final String PACKAGE_WILDCARD_SUFFIX = ".*";

    /** Parameter names for agent configuration */
    private static final String PARAM_INCLUDE = "include";
    private static final String PARAM_EXCLUDE = "exclude";
    private static final String PARAM_ANNOTATED_ONLY = "annotatedOnly";

    private final Set<String> includePatterns;  // Contains both package and class inclusions
    private final Set<String> excludePatterns;  // Contains both package and class exclusions
    private final boolean annotatedOnly;        // Trace only @Traced methods

    private AgentConfig(Set<String> includePatterns, Set<String> excludePatterns, boolean annotatedOnly) {
        this.includePatterns = includePatterns;
        this.excludePatterns = excludePatterns;
        this.annotatedOnly = annotatedOnly;
    }

    /**
     * Validate a pattern string for include/exclude.
     * @param pattern The pattern to validate
     * @param paramName The parameter name (for error messages)
     * @throws IllegalArgumentException if the pattern is invalid
     */
    private static void validatePattern(String pattern, String paramName) {
        if (pattern.isEmpty()) {
            throw new IllegalArgumentException(
                paramName + ": Empty pattern not allowed");
        }

        if (pattern.contains("..")) {
            throw new IllegalArgumentException(
                paramName + ": Invalid pattern with consecutive dots: " + pattern);
        }

        if (pattern.equals(".*") || pattern.equals("*")) {
            throw new IllegalArgumentException(
                paramName + ": Global wildcard not allowed (would match all classes): " + pattern);
        }

        if (pattern.endsWith(".") && !pattern.endsWith(".*")) {
            throw new IllegalArgumentException(
                paramName + ": Package patterns must end with .* not just . : " + pattern);
        }

        if (pattern.contains(".**")) {
            throw new IllegalArgumentException(
                paramName + ": Invalid pattern with .** (use .* instead): " + pattern);
        }
    }

    /**
     * Parse agent arguments.
     * Format: include=package.*,SpecificClass;exclude=package.*,SpecificClass;annotatedOnly=false
     *
     * Examples:
     * - include=com.example.* (package with .* suffix)
     * - include=com.example.MyClass (specific class without .* suffix)
     * - include=com.example.Outer$Inner (inner class with $ separator)
     * - exclude=com.example.test.* (package exclusion)
     * - annotatedOnly=false (trace every method of included classes, not just @Traced ones)
     */
    public static AgentConfig parse(String arguments) {
        Set<String> include = new HashSet<>();
        Set<String> exclude = new HashSet<>();
        boolean annotatedOnly = true;

        if (arguments != null && !arguments.isEmpty()) {
            String[] parts = arguments.split(";");
            for (String part : parts) {
                String[] kv = part.split("=", 2); // Use limit=2 to handle class names with = in them
                if (kv.length == 2) {
                    String key = kv[0].trim();
                    String value = kv[1].trim();

                    if (PARAM_INCLUDE.equals(key)) {
                        for (String pattern : value.split(",", -1)) {
                            String trimmed = pattern.trim();
                            validatePattern(trimmed, PARAM_INCLUDE);
                            include.add(trimmed);
                        }
                    } else if (PARAM_EXCLUDE.equals(key)) {
                        for (String pattern : value.split(",", -1)) {
                            String trimmed = pattern.trim();
                            validatePattern(trimmed, PARAM_EXCLUDE);
                            exclude.add(trimmed);
                        }
                    } else if (PARAM_ANNOTATED_ONLY.equals(key)) {
                        annotatedOnly = Boolean.parseBoolean(value);
                    }
                }
            }
        }

        // Default to common application packages if none specified
        if (include.isEmpty()) {
            include.add("com.*");
            include.add("org.*");
            include.add("net.*");
        }

        return new AgentConfig(include, exclude, annotatedOnly);
    }

    /**
     * Applies exclusion patterns to a matcher.
     * Exclusions support both package-level and class-level patterns:
     * - Package: "com.example.protocol.*" excludes all classes in package/subpackages
     * - Class: "com.example.protocol.SpecificClass" excludes only that specific class
     */
    private ElementMatcher.Junction<TypeDescription> applyExclusions(
            ElementMatcher.Junction<TypeDescription> matcher) {
        for (String exclude : excludePatterns) {
            if (exclude.endsWith(PACKAGE_WILDCARD_SUFFIX)) {
                String prefix = exclude.substring(0, exclude.length() - PACKAGE_WILDCARD_SUFFIX.length());
                matcher = matcher.and(not(nameStartsWith(prefix)));
            } else {
                matcher = matcher.and(not(named(exclude)));
            }
        }
        return matcher;
    }

    /**
     * Get type matcher based on configuration.
     * Exclusions take precedence over inclusions.
     */
    public ElementMatcher.Junction<TypeDescription> getTypeMatcher() {
        ElementMatcher.Junction<TypeDescription> matcher = none();

        for (String include : includePatterns) {
            if (include.endsWith(PACKAGE_WILDCARD_SUFFIX)) {
                String prefix = include.substring(0, include.length() - PACKAGE_WILDCARD_SUFFIX.length());
                matcher = matcher.or(nameStartsWith(prefix));
            } else {
                matcher = matcher.or(named(include));
            }
        }

        return applyExclusions(matcher);
    }

    public Set<String> getIncludePatterns() {
        return includePatterns;
    }

    public Set<String> getExcludePatterns() {
        return excludePatterns;
    }

    /**
     * Check if only @Traced methods are instrumented
     */
    public boolean isAnnotatedOnly() {
        return annotatedOnly;
    }

    @Override
    public String toString() {
        return "AgentConfig{include=" + includePatterns +
               ", exclude=" + excludePatterns +
               ", annotatedOnly=" + annotatedOnly + "}";
    }
}
