package edu.monash.aws.jwt_authorizer.policy;

import dev.cel.common.CelAbstractSyntaxTree;
import dev.cel.common.CelValidationException;
import dev.cel.common.types.CelType;
import dev.cel.common.types.MapType;
import dev.cel.common.types.SimpleType;
import dev.cel.compiler.CelCompiler;
import dev.cel.compiler.CelCompilerFactory;
import dev.cel.parser.CelStandardMacro;
import dev.cel.runtime.CelEvaluationException;
import dev.cel.runtime.CelRuntime;
import dev.cel.runtime.CelRuntimeFactory;
import edu.monash.aws.jwt_authorizer.ConfigurationException;
import edu.monash.aws.jwt_authorizer.DenyReason;
import edu.monash.aws.jwt_authorizer.TokenRejectedException;
import lombok.Getter;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Optional custom validation rule written in CEL (Common Expression Language).
 *
 * <p>The expression sees two variables, {@code header} and {@code claims}, holding the
 * decoded token header and payload, and has to evaluate to {@code true} for the token
 * to be accepted. For example:
 * <pre>
 * claims.sub != "" &amp;&amp; claims.email_verified == true
 * has(claims.acr) ? claims.acr == "urn:mfa" : false
 * claims.scopes.all(s, s.startsWith("read:"))
 * </pre>
 * Accessing a claim the token does not have is an evaluation error, which denies the
 * token; guard optional claims with {@code has()}.
 */
public class PolicyEvaluator {
    protected static String headerVariable = "header";
    protected static String claimsVariable = "claims";

    private static final CelType JSON_OBJECT = MapType.create(SimpleType.STRING, SimpleType.DYN);

    private static final CelCompiler COMPILER = CelCompilerFactory.standardCelCompilerBuilder()
            .setStandardMacros(CelStandardMacro.STANDARD_MACROS)
            .addVar(headerVariable, JSON_OBJECT)
            .addVar(claimsVariable, JSON_OBJECT)
            .build();

    private static final CelRuntime RUNTIME = CelRuntimeFactory.standardCelRuntimeBuilder().build();

    @Getter
    private final String expression;
    private final CelRuntime.Program program;

    private PolicyEvaluator(String expression, CelRuntime.Program program) {
        this.expression = expression;
        this.program = program;
    }

    public static PolicyEvaluator permitAll() {
        return new PolicyEvaluator("", null);
    }

    /**
     * Compiles {@code expression}; a blank expression accepts every token.
     *
     * @throws ConfigurationException if the expression does not compile or cannot yield a boolean
     */
    public static PolicyEvaluator compile(String expression) {
        if (expression == null || expression.isBlank()) {
            return permitAll();
        }

        try {
            CelAbstractSyntaxTree ast = COMPILER.compile(expression).getAst();
            CelType resultType = ast.getResultType();
            if (!resultType.equals(SimpleType.BOOL) && !resultType.equals(SimpleType.DYN)) {
                throw new ConfigurationException("CEL expression must evaluate to a boolean value, found "
                        + resultType + ": " + expression);
            }
            return new PolicyEvaluator(expression, RUNTIME.createProgram(ast));
        } catch (CelValidationException e) {
            throw new ConfigurationException("Failed to compile CEL expression: " + e.getMessage(), e);
        } catch (CelEvaluationException e) {
            throw new ConfigurationException("Failed to plan CEL expression: " + e.getMessage(), e);
        }
    }

    public boolean isEnabled() {
        return program != null;
    }

    public void evaluate(Map<String, Object> header, Map<String, Object> claims) throws TokenRejectedException {
        if (program == null) {
            return;
        }

        Object result;
        try {
            result = program.eval(Map.of(
                    headerVariable, toCelValue(header),
                    claimsVariable, toCelValue(claims)));
        } catch (CelEvaluationException | RuntimeException e) {
            throw new TokenRejectedException(DenyReason.POLICY_REJECTED,
                    "CEL validation failed (expression='" + expression + "'): " + e.getMessage(), e);
        }

        if (!(result instanceof Boolean)) {
            throw new TokenRejectedException(DenyReason.POLICY_REJECTED,
                    "CEL expression must evaluate to a boolean value (expression='" + expression + "')");
        }
        if (!((Boolean) result)) {
            throw new TokenRejectedException(DenyReason.POLICY_REJECTED,
                    "CEL expression '" + expression + "' evaluated to false");
        }
    }

    /**
     * Maps decoded JSON onto the types the CEL runtime expects. {@code null} members are
     * dropped, so {@code has()} reports them as absent.
     */
    static Object toCelValue(Object value) {
        if (value instanceof Map) {
            Map<String, Object> map = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                if (entry.getValue() != null) {
                    map.put(String.valueOf(entry.getKey()), toCelValue(entry.getValue()));
                }
            }
            return map;
        } else if (value instanceof Collection) {
            List<Object> list = new ArrayList<>();
            for (Object item : (Collection<?>) value) {
                if (item != null) {
                    list.add(toCelValue(item));
                }
            }
            return list;
        } else if (value instanceof Integer || value instanceof Long || value instanceof Short
                || value instanceof Byte) {
            return ((Number) value).longValue();
        } else if (value instanceof BigInteger) {
            BigInteger big = (BigInteger) value;
            return big.bitLength() < Long.SIZE ? (Object) big.longValue() : (Object) big.doubleValue();
        } else if (value instanceof Float || value instanceof Double || value instanceof BigDecimal) {
            return ((Number) value).doubleValue();
        } else if (value instanceof String || value instanceof Boolean) {
            return value;
        }
        return String.valueOf(value);
    }
}
