package io.lighting.rsx.reload;

import io.lighting.rsx.diff.DiffOptions;
import io.lighting.rsx.diff.TemplateDiffer;
import io.lighting.rsx.diff.Verdict;
import io.lighting.rsx.markup.ParseResult;
import io.lighting.rsx.markup.ParserOptions;
import io.lighting.rsx.markup.SyntaxError;
import io.lighting.rsx.markup.Template;
import io.lighting.rsx.markup.TemplateKey;
import io.lighting.rsx.markup.TemplateSource;
import io.lighting.rsx.markup.Templates;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Remembers the last successfully parsed version of every template and
 * reconciles edits against it.
 * <p>
 * One session lives as long as the development server. Writes ({@link #seed},
 * {@link #reconcile}, {@link #reconcileFile}) are serialised; the cache is an
 * immutable map replaced in one step, so {@link #snapshot()} and
 * {@link #template(TemplateKey)} never observe a half-applied update and do not
 * block.
 * <pre>{@code
 * try (HotReloadSession session = HotReloadSession.builder()
 *         .observer(ReloadLog.builder().build())
 *         .start()) {
 *     session.seed(initialSources);
 *     for (ReconciliationRecord record : session.reconcileFile(file, changedSources)) {
 *         transport.send(HotReloadMessage.forRecord(record));
 *     }
 * }
 * }</pre>
 */
public final class HotReloadSession implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(HotReloadSession.class);

    private final ParserOptions parserOptions;
    private final TemplateDiffer differ;
    private final List<ReloadObserver> observers;
    private final ReentrantLock writeLock = new ReentrantLock();

    private volatile Map<TemplateKey, Template> templates = Map.of();
    private volatile boolean closed;

    private HotReloadSession(Builder builder) {
        this.parserOptions = builder.parserOptions;
        this.differ = new TemplateDiffer(builder.diffOptions);
        this.observers = List.copyOf(builder.observers);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Parses and caches the initial templates of a workspace. Sources that do
     * not parse are skipped and returned as errors.
     */
    public List<SyntaxError> seed(Collection<TemplateSource> sources) {
        Objects.requireNonNull(sources, "sources");
        writeLock.lock();
        try {
            ensureOpen();
            Map<TemplateKey, Template> next = new LinkedHashMap<>(templates);
            List<SyntaxError> errors = new ArrayList<>();
            for (TemplateSource source : sources) {
                ParseResult result = Templates.tryParse(source, parserOptions);
                if (result instanceof ParseResult.Success success) {
                    next.put(source.key(), success.template());
                    observers.forEach(observer -> observer.onSeeded(source.key()));
                } else {
                    SyntaxError error = ((ParseResult.Failure) result).error();
                    LOGGER.warn("Skipping template {} while seeding: {}", source.key(), error.describe());
                    errors.add(error);
                    observers.forEach(observer -> observer.onSyntaxError(source.key(), error));
                }
            }
            publish(next);
            LOGGER.debug("Seeded {} templates ({} with syntax errors)", sources.size() - errors.size(), errors.size());
            return List.copyOf(errors);
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Reparses one edited invocation and compares it with the cached version.
     * <p>
     * A syntax error yields a rebuild verdict pointing at the error and leaves the
     * cache untouched. Any successful parse replaces the cached template, so the
     * next edit is compared against what the developer last saved.
     */
    public ReconciliationRecord reconcile(TemplateSource source) {
        Objects.requireNonNull(source, "source");
        writeLock.lock();
        try {
            ensureOpen();
            Map<TemplateKey, Template> next = new LinkedHashMap<>(templates);
            ReconciliationRecord record = reconcileInto(next, source);
            publish(next);
            return record;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Reconciles every invocation found in one file. Cached templates of that
     * file whose key no longer appears are evicted and reported as rebuilds.
     *
     * @throws IllegalArgumentException if a source belongs to another file
     */
    public List<ReconciliationRecord> reconcileFile(String file, Collection<TemplateSource> sources) {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(sources, "sources");
        for (TemplateSource source : sources) {
            if (!source.file().equals(file)) {
                throw new IllegalArgumentException("Template " + source.key() + " does not belong to " + file);
            }
        }
        writeLock.lock();
        try {
            ensureOpen();
            Map<TemplateKey, Template> next = new LinkedHashMap<>(templates);
            List<ReconciliationRecord> records = new ArrayList<>();
            Set<TemplateKey> present = new LinkedHashSet<>();
            for (TemplateSource source : sources) {
                present.add(source.key());
                records.add(reconcileInto(next, source));
            }
            for (Template cached : templates.values()) {
                TemplateKey key = cached.key();
                if (!key.file().equals(file) || present.contains(key)) {
                    continue;
                }
                next.remove(key);
                LOGGER.debug("Template {} was removed from {}", key, file);
                observers.forEach(observer -> observer.onEvicted(key));
                records.add(ReconciliationRecord.rebuild(key, "Template was removed", cached.span()));
            }
            publish(next);
            return List.copyOf(records);
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * The cached templates at this moment. The map never changes afterwards.
     */
    public Map<TemplateKey, Template> snapshot() {
        ensureOpen();
        return templates;
    }

    public Optional<Template> template(TemplateKey key) {
        Objects.requireNonNull(key, "key");
        ensureOpen();
        return Optional.ofNullable(templates.get(key));
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        writeLock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            templates = Map.of();
            observers.forEach(ReloadObserver::onClose);
            LOGGER.debug("Hot-reload session closed");
        } finally {
            writeLock.unlock();
        }
    }

    private ReconciliationRecord reconcileInto(Map<TemplateKey, Template> next, TemplateSource source) {
        long start = System.nanoTime();
        TemplateKey key = source.key();
        ParseResult result = Templates.tryParse(source, parserOptions);
        if (result instanceof ParseResult.Failure failure) {
            SyntaxError error = failure.error();
            LOGGER.warn("Template {} does not parse: {}", key, error.describe());
            observers.forEach(observer -> observer.onSyntaxError(key, error));
            return finish(
                ReconciliationRecord.rebuild(key, "Syntax error: " + error.message(), error.span()),
                start
            );
        }
        Template parsed = ((ParseResult.Success) result).template();
        Template cached = next.put(key, parsed);
        if (cached == null) {
            return finish(ReconciliationRecord.rebuild(key, "New template", parsed.span()), start);
        }
        Verdict verdict = differ.compare(cached, parsed);
        return finish(new ReconciliationRecord(key, verdict), start);
    }

    private ReconciliationRecord finish(ReconciliationRecord record, long start) {
        long elapsed = System.nanoTime() - start;
        LOGGER.debug(
            "Reconciled {}: {}",
            record.templateKey(),
            record.hotReloadable() ? "hot-reloadable" : "needs full rebuild"
        );
        observers.forEach(observer -> observer.onReconciled(record, elapsed));
        return record;
    }

    private void publish(Map<TemplateKey, Template> next) {
        templates = Collections.unmodifiableMap(next);
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Hot-reload session is closed");
        }
    }

    public static final class Builder {
        private ParserOptions parserOptions = ParserOptions.defaults();
        private DiffOptions diffOptions = DiffOptions.defaults();
        private final List<ReloadObserver> observers = new ArrayList<>();

        private Builder() {
        }

        public Builder parserOptions(ParserOptions parserOptions) {
            this.parserOptions = Objects.requireNonNull(parserOptions, "parserOptions");
            return this;
        }

        public Builder diffOptions(DiffOptions diffOptions) {
            this.diffOptions = Objects.requireNonNull(diffOptions, "diffOptions");
            return this;
        }

        public Builder observer(ReloadObserver observer) {
            observers.add(Objects.requireNonNull(observer, "observer"));
            return this;
        }

        public HotReloadSession start() {
            HotReloadSession session = new HotReloadSession(this);
            LOGGER.debug("Hot-reload session started with {} observers", session.observers.size());
            return session;
        }
    }
}
