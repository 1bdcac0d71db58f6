package de.burger.it.infrastructure.logging;

import org.aspectj.lang.JoinPoint;
import org.aspectj.lang.annotation.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.Arrays;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Traces entry, exit and failures of the refactorer's public operations under the target class
 * logger (not the aspect logger), with a {@code cid} correlation id in the MDC.
 * Weaving is opt-in: the aspect only runs where load-time weaving is enabled via META-INF/aop.xml.
 */
@SuppressWarnings("AspectJ") // suppress IDE warning; weaving is opt-in
@Aspect
public class MethodLoggingAspect {

    // Code-style aspect accessors expected by load-time weaving
    private static final MethodLoggingAspect INSTANCE = new MethodLoggingAspect();
    public static MethodLoggingAspect aspectOf() { return INSTANCE; }
    public static boolean hasAspect() { return true; }

    private static final Map<Class<?>, Logger> PER_CLASS_LOGGERS = new ConcurrentHashMap<>();
    private static final ThreadLocal<Long> START_NS = new ThreadLocal<>();
    private static final String CID = "cid";
    private static final int MAX_ARG_CHARS = 120;

    // File mirror independent of the SLF4J provider; off unless requested
    static final String LOG_FILE_PROP = "slf4j.refactor.logFile";
    static final String LOG_TO_FILE_PROP = "slf4j.refactor.logToFile";
    private static final String DEFAULT_LOG_FILE = "logs/slf4j-refactor.log";

    @Pointcut("execution(public * de.burger.slf4j.refactor..*(..))")
    public void appOps() {}

    @Pointcut("within(@de.burger.it.infrastructure.logging.SuppressLogging *) || @annotation(de.burger.it.infrastructure.logging.SuppressLogging)")
    public void suppressed() {}

    @Before("appOps() && !suppressed()")
    public void onEnter(final JoinPoint jp) {
        MDC.put(CID, Optional.ofNullable(MDC.get(CID))
                .filter(s -> !s.isBlank())
                .orElseGet(() -> UUID.randomUUID().toString()));

        START_NS.set(System.nanoTime());

        final Logger logger = loggerFor(jp);
        if (logger.isDebugEnabled()) {
            final String msg = String.format("→ %s %s", shortSig(jp), argsOf(jp));
            logger.debug(msg);
            fileLog("DEBUG", msg);
        }
    }

    @AfterReturning("appOps() && !suppressed()")
    public void onReturn(final JoinPoint jp) {
        final long elapsedMs = elapsedMillis();
        final Logger logger = loggerFor(jp);
        if (logger.isDebugEnabled()) {
            final String msg = String.format("← %s OK in %d ms", shortSig(jp), elapsedMs);
            logger.debug(msg);
            fileLog("DEBUG", msg);
        }
    }

    @AfterThrowing(pointcut = "appOps() && !suppressed()", throwing = "ex")
    public void onThrow(final JoinPoint jp, final Throwable ex) {
        final long elapsedMs = elapsedMillis();
        final String msg = String.format("✖ %s failed in %d ms: %s", shortSig(jp), elapsedMs, ex.getMessage());
        loggerFor(jp).error(msg, ex);
        fileLog("ERROR", msg + " (see stacktrace in console)");
    }

    // ---- helpers ----

    private long elapsedMillis() {
        final Long started = START_NS.get();
        START_NS.remove();
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - (started != null ? started : System.nanoTime()));
    }

    /**
     * Resolve the logger for the declaring type of the advised method and cache it.
     */
    private Logger loggerFor(JoinPoint jp) {
        final Class<?> type = jp.getSignature().getDeclaringType();
        return PER_CLASS_LOGGERS.computeIfAbsent(type, LoggerFactory::getLogger);
    }

    /**
     * Short signature like 'ChainRewriter.rewrite(..)'.
     */
    private String shortSig(JoinPoint jp) {
        return jp.getSignature().toShortString();
    }

    /**
     * Render arguments safely; source texts are abbreviated to one line.
     */
    private String argsOf(JoinPoint jp) {
        return Arrays.stream(jp.getArgs())
                .map(this::safeToString)
                .collect(Collectors.joining(", ", "[", "]"));
    }

    private String safeToString(Object o) {
        final String text = Optional.ofNullable(o).map(Objects::toString).orElse("null").replaceAll("\\s+", " ");
        return text.length() > MAX_ARG_CHARS ? text.substring(0, MAX_ARG_CHARS) + "…" : text;
    }

    private void fileLog(String level, String message) {
        if (!Boolean.parseBoolean(System.getProperty(LOG_TO_FILE_PROP, "false"))) {
            return;
        }
        try {
            final java.io.File file = new java.io.File(System.getProperty(LOG_FILE_PROP, DEFAULT_LOG_FILE));
            final java.io.File parent = file.getParentFile();
            if (parent != null && !parent.exists()) {
                // noinspection ResultOfMethodCallIgnored
                parent.mkdirs();
            }
            final String ts = java.time.format.DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS")
                    .format(java.time.LocalDateTime.now());
            final String cid = Optional.ofNullable(MDC.get(CID)).orElse("-");
            final String line = ts + " [" + level + "] [cid=" + cid + "] " + message + "\n";
            try (java.io.FileWriter fw = new java.io.FileWriter(file, java.nio.charset.StandardCharsets.UTF_8, true)) {
                fw.write(line);
            }
        } catch (java.io.IOException ex) {
            LoggerFactory.getLogger(MethodLoggingAspect.class).warn("Cannot mirror trace to file: {}", ex.getMessage());
        }
    }
}
