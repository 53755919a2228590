package org.kidoni.calculus.cli;

import java.io.PrintStream;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

import org.kidoni.calculus.ExpressionException;
import org.kidoni.calculus.ExpressionParser;
import org.kidoni.calculus.domain.ComplexDomain;
import org.kidoni.calculus.domain.NumericDomain;
import org.kidoni.calculus.domain.RealDomain;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command line front end.
 * <pre>
 *  --eval &lt;expr&gt; &lt;name&gt;=&lt;value&gt;...   print the value of expr
 *  --diff &lt;expr&gt; --by &lt;name&gt;            print the derivative of expr
 * </pre>
 * Binding values are constant expressions, e.g. {@code x=-2} or {@code z=1+2i}. The numeric domain
 * comes from the {@value #DOMAIN_ENV} environment variable: {@code real}, {@code complex} or
 * {@code auto} (the default), which picks complex when an imaginary literal occurs.
 */
public final class ExpressionCli {
    private static final Logger logger = LoggerFactory.getLogger(ExpressionCli.class);

    static final String DOMAIN_ENV = "EXPRESSION_DOMAIN";

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_ERROR = 2;

    private static final String USAGE = """
            usage: --eval <expr> <name>=<value>...
                   --diff <expr> --by <name>""";

    private final PrintStream out;
    private final PrintStream err;
    private final String domainSetting;

    ExpressionCli(final PrintStream out, final PrintStream err, final String domainSetting) {
        this.out = out;
        this.err = err;
        this.domainSetting = domainSetting;
    }

    public static void main(String[] args) {
        int status = new ExpressionCli(System.out, System.err, System.getenv(DOMAIN_ENV)).run(args);
        System.exit(status);
    }

    int run(final String... args) {
        if (args.length < 2) {
            return usage("missing command or expression");
        }

        final DomainSetting setting;
        try {
            setting = DomainSetting.from(domainSetting);
        }
        catch (IllegalArgumentException e) {
            return usage(e.getMessage());
        }

        try {
            switch (args[0]) {
                case "--eval" -> {
                    final Map<String, String> bindings = readBindings(args);
                    final String expr = args[1];
                    final boolean complex = setting.requiresComplex(expr) || bindings.values().stream().anyMatch(setting::requiresComplex);
                    out.println(complex ? evaluate(ComplexDomain.INSTANCE, expr, bindings) : evaluate(RealDomain.INSTANCE, expr, bindings));
                }
                case "--diff" -> {
                    if (args.length != 4 || !args[2].equals("--by")) {
                        return usage("--diff takes an expression and --by <name>");
                    }
                    final String expr = args[1];
                    final String variable = args[3].toLowerCase(Locale.ROOT);
                    out.println(setting.requiresComplex(expr) ? differentiate(ComplexDomain.INSTANCE, expr, variable) : differentiate(RealDomain.INSTANCE, expr, variable));
                }
                default -> {
                    return usage("unknown command: " + args[0]);
                }
            }
        }
        catch (UsageException e) {
            return usage(e.getMessage());
        }
        catch (DuplicateBindingException e) {
            err.println("error: " + e.getMessage());
            return EXIT_USAGE;
        }
        catch (ExpressionException e) {
            logger.debug("{} failed", args[0], e);
            err.println("error: " + e.getMessage());
            return EXIT_ERROR;
        }

        return EXIT_OK;
    }

    private static Map<String, String> readBindings(final String[] args) {
        final Map<String, String> bindings = new LinkedHashMap<>();
        for (int i = 2; i < args.length; i++) {
            final int eq = args[i].indexOf('=');
            if (eq <= 0 || eq == args[i].length() - 1) {
                throw new UsageException("binding must look like <name>=<value>: " + args[i]);
            }

            final String name = args[i].substring(0, eq).trim().toLowerCase(Locale.ROOT);
            if (bindings.put(name, args[i].substring(eq + 1)) != null) {
                throw new DuplicateBindingException(name);
            }
        }
        return bindings;
    }

    private static <T> String evaluate(final NumericDomain<T> domain, final String expr, final Map<String, String> bindings) {
        final ExpressionParser<T> parser = new ExpressionParser<>(domain);

        final Map<String, T> values = new HashMap<>();
        bindings.forEach((name, value) -> values.put(name, parser.parse(value).eval(Map.of())));

        return domain.format(parser.parse(expr).eval(values));
    }

    private static <T> String differentiate(final NumericDomain<T> domain, final String expr, final String variable) {
        return new ExpressionParser<>(domain).parse(expr).differentiate(variable).serialize();
    }

    private int usage(final String message) {
        err.println("error: " + message);
        err.println(USAGE);
        return EXIT_USAGE;
    }

    enum DomainSetting {
        REAL,
        COMPLEX,
        AUTO;

        static DomainSetting from(final String value) {
            if (value == null || value.isBlank()) {
                return AUTO;
            }
            try {
                return valueOf(value.trim().toUpperCase(Locale.ROOT));
            }
            catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("unknown " + DOMAIN_ENV + " value: " + value, e);
            }
        }

        boolean requiresComplex(final String text) {
            return switch (this) {
                case REAL -> false;
                case COMPLEX -> true;
                case AUTO -> ExpressionParser.containsImaginaryLiteral(text);
            };
        }
    }

    private static class UsageException extends RuntimeException {
        UsageException(final String message) {
            super(message);
        }
    }
}
