package io.lintsignal.rule;

import io.lintsignal.config.JsxRuntime;
import io.lintsignal.config.QuoteStyle;
import io.lintsignal.syntax.SyntaxNode;

import java.nio.file.Path;
import java.util.List;

/**
 * Everything a rule hook can see while evaluating one match: the query result, the tree,
 * the services and the resolved options.
 * <p>
 * Contexts are cheap and short-lived; a new one is built for every hook invocation.
 *
 * @param <Q> query result type
 * @param <O> options type
 */
public final class RuleContext<Q, O> {

    private final Q query;
    private final SyntaxNode root;
    private final ServiceBag services;
    private final List<String> globals;
    private final Path filePath;
    private final O options;
    private final QuoteStyle preferredQuote;
    private final JsxRuntime jsxRuntime;
    private final RuleMetadata metadata;

    private RuleContext(Builder<Q, O> builder) {
        this.query = builder.query;
        this.root = builder.root;
        this.services = builder.services;
        this.globals = builder.globals;
        this.filePath = builder.filePath;
        this.options = builder.options;
        this.preferredQuote = builder.preferredQuote;
        this.jsxRuntime = builder.jsxRuntime;
        this.metadata = builder.rule.metadata();
    }

    /**
     * Starts building a context for the given rule and query result.
     */
    public static <Q, O> Builder<Q, O> builder(Rule<Q, ?, O> rule, Q query) {
        return new Builder<>(rule, query);
    }

    public Q query() {
        return query;
    }

    public SyntaxNode root() {
        return root;
    }

    /**
     * Returns a service the rule declared in {@link Rule#requiredServices()}.
     *
     * @throws IllegalStateException if the service is not in the bag, which only happens
     *                               for services the rule did not declare
     */
    public <T> T service(Class<T> type) {
        return services.get(type)
                .orElseThrow(() -> new IllegalStateException(
                        "Service " + type.getSimpleName() + " is not available to rule " + metadata.ruleKey()));
    }

    public List<String> globals() {
        return globals;
    }

    public boolean isGlobal(String name) {
        return globals.contains(name);
    }

    public Path filePath() {
        return filePath;
    }

    public O options() {
        return options;
    }

    public QuoteStyle preferredQuote() {
        return preferredQuote;
    }

    public JsxRuntime jsxRuntime() {
        return jsxRuntime;
    }

    public RuleMetadata metadata() {
        return metadata;
    }

    /**
     * Builder for {@link RuleContext}.
     */
    public static final class Builder<Q, O> {
        private final Rule<Q, ?, O> rule;
        private final Q query;
        private SyntaxNode root;
        private ServiceBag services = ServiceBag.empty();
        private List<String> globals = List.of();
        private Path filePath = Path.of("");
        private O options;
        private QuoteStyle preferredQuote = QuoteStyle.DOUBLE;
        private JsxRuntime jsxRuntime = JsxRuntime.TRANSPARENT;

        private Builder(Rule<Q, ?, O> rule, Q query) {
            this.rule = rule;
            this.query = query;
        }

        public Builder<Q, O> root(SyntaxNode root) {
            this.root = root;
            return this;
        }

        public Builder<Q, O> services(ServiceBag services) {
            this.services = services;
            return this;
        }

        public Builder<Q, O> globals(List<String> globals) {
            this.globals = List.copyOf(globals);
            return this;
        }

        public Builder<Q, O> filePath(Path filePath) {
            this.filePath = filePath;
            return this;
        }

        public Builder<Q, O> options(O options) {
            this.options = options;
            return this;
        }

        public Builder<Q, O> preferredQuote(QuoteStyle preferredQuote) {
            this.preferredQuote = preferredQuote;
            return this;
        }

        public Builder<Q, O> jsxRuntime(JsxRuntime jsxRuntime) {
            this.jsxRuntime = jsxRuntime;
            return this;
        }

        /**
         * Builds the context.
         *
         * @throws RuleContextException if a service the rule requires is missing
         */
        public RuleContext<Q, O> build() throws RuleContextException {
            if (root == null) {
                throw new IllegalStateException("root is required");
            }
            for (Class<?> required : rule.requiredServices()) {
                if (!services.contains(required)) {
                    throw new RuleContextException("Rule " + rule.metadata().ruleKey()
                            + " requires service " + required.getSimpleName());
                }
            }
            if (options == null) {
                options = rule.defaultOptions();
            }
            return new RuleContext<>(this);
        }
    }
}
