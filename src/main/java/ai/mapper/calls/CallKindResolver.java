package ai.mapper.calls;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import ai.mapper.model.CallKind;
import ai.mapper.scip.Descriptor;
import ai.mapper.scip.ScipSymbol;

/**
 * Classifies call records into a {@link CallKind}.
 * <p>
 * The callee symbol's last descriptor decides the shape (method, property/constant access, free
 * function, class); the kind recorded by the producer only fills in what the shape leaves open,
 * that is static-ness and calls whose callee is missing or unparseable.
 * <p>
 * Static-ness is judged on the immediate receiver. In {@code obj.getName().trim()} the receiver
 * of {@code trim()} is the value produced by {@code getName()}, so {@code trim()} is an instance
 * method call whatever the outer expression looks like.
 */
public final class CallKindResolver {

    private static final String CONSTRUCTOR_NAME = "__construct";

    /**
     * What the callee symbol says about the call site.
     */
    enum CalleeShape {
        METHOD, FIELD, FUNCTION, TYPE, UNKNOWN
    }

    /**
     * What a call is made on.
     */
    public enum Receiver {
        /** No receiver value: free function, static or constructor call. */
        NONE,
        /** A variable, parameter, property or literal. */
        VALUE,
        /** The result of another call or access: a chain. */
        CALL_RESULT
    }

    private final Map<String, CallRecord> producers = new HashMap<>();
    private final Map<String, ValueRecord> values = new HashMap<>();

    public CallKindResolver(CallsData data) {
        Objects.requireNonNull(data, "data");
        for (ValueRecord v : data.values()) {
            if (v.id() != null) {
                values.putIfAbsent(v.id(), v);
            }
        }
        for (CallRecord c : data.calls()) {
            if (c.id() == null) {
                continue;
            }
            // a call's result value shares its id unless it names another one
            producers.putIfAbsent(c.id(), c);
            if (c.resultValueId() != null) {
                producers.putIfAbsent(c.resultValueId(), c);
            }
        }
    }

    public CallKind resolve(CallRecord call) {
        final Optional<CallKind> recorded = CallKind.fromLabel(call.kind());
        final Receiver receiver = receiverOf(call);

        return switch (shapeOf(call.callee())) {
            case METHOD -> isConstructor(call.callee(), recorded)
                    ? CallKind.CONSTRUCTOR
                    : isStatic(recorded, receiver) ? CallKind.METHOD_STATIC : CallKind.METHOD;
            case FIELD -> isStatic(recorded, receiver) ? CallKind.ACCESS_STATIC : CallKind.ACCESS;
            case FUNCTION -> CallKind.FUNCTION;
            case TYPE -> CallKind.CONSTRUCTOR;
            case UNKNOWN -> recorded
                    .map(kind -> receiver == Receiver.CALL_RESULT ? instanceVariant(kind) : kind)
                    .orElse(receiver == Receiver.NONE ? CallKind.FUNCTION : CallKind.METHOD);
        };
    }

    public Receiver receiverOf(CallRecord call) {
        final String receiverId = call.receiverValueId();
        if (receiverId == null || receiverId.isBlank()) {
            return Receiver.NONE;
        }
        final CallRecord producer = producers.get(receiverId);
        if (producer != null && producer != call) {
            return Receiver.CALL_RESULT;
        }
        final ValueRecord value = values.get(receiverId);
        return value != null && "result".equals(value.kind()) ? Receiver.CALL_RESULT : Receiver.VALUE;
    }

    static CalleeShape shapeOf(String callee) {
        final Optional<ScipSymbol> parsed = ScipSymbol.parse(callee);
        if (parsed.isEmpty() || parsed.get().local()) {
            return CalleeShape.UNKNOWN;
        }
        final ScipSymbol symbol = parsed.get();
        final Descriptor last = symbol.last().orElseThrow();
        return switch (last.suffix()) {
            case METHOD -> symbol.hasTypeOwner() ? CalleeShape.METHOD : CalleeShape.FUNCTION;
            case TERM -> symbol.hasTypeOwner() ? CalleeShape.FIELD : CalleeShape.UNKNOWN;
            case TYPE -> CalleeShape.TYPE;
            case NAMESPACE, TYPE_PARAMETER, PARAMETER, META, MACRO -> CalleeShape.UNKNOWN;
        };
    }

    private static boolean isConstructor(String callee, Optional<CallKind> recorded) {
        if (recorded.filter(k -> k == CallKind.CONSTRUCTOR).isPresent()) {
            return true;
        }
        return ScipSymbol.parse(callee)
                .flatMap(ScipSymbol::last)
                .map(d -> CONSTRUCTOR_NAME.equals(d.name()))
                .orElse(false);
    }

    /**
     * A chained call is never static. Without a recorded kind, a member call with no receiver
     * ({@code self::x()}, {@code Foo::x()}) is static.
     */
    private static boolean isStatic(Optional<CallKind> recorded, Receiver receiver) {
        if (receiver == Receiver.CALL_RESULT) {
            return false;
        }
        return recorded.map(CallKindResolver::isStaticKind).orElse(receiver == Receiver.NONE);
    }

    private static boolean isStaticKind(CallKind kind) {
        return switch (kind) {
            case METHOD_STATIC, ACCESS_STATIC -> true;
            case FUNCTION, METHOD, CONSTRUCTOR, ACCESS -> false;
        };
    }

    static CallKind instanceVariant(CallKind kind) {
        return switch (kind) {
            case METHOD_STATIC -> CallKind.METHOD;
            case ACCESS_STATIC -> CallKind.ACCESS;
            case FUNCTION, METHOD, CONSTRUCTOR, ACCESS -> kind;
        };
    }
}
