package works.polyfail;

import java.lang.invoke.MethodType;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;
import works.polyfail.exceptions.PayloadTypeException;
import works.polyfail.exceptions.ReservedLabelException;

/**
 * Names one failure case of a {@link Schema} and fixes the type of the payload it carries.
 *
 * <p>
 * Two labels are the same label if they have the same name and payload class.
 * For parameterized payload types, see {@link works.polyfail.util.Classes}.
 *
 * @param <P> the payload type
 */
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
@EqualsAndHashCode
public final class Label<P> {
	@NonNull final String name;
	@NonNull final Class<P> payloadType;

	/**
	 * The name of the success slot. No failure label may use it.
	 */
	public static final String SUCCESS_NAME = "_";

	public static <PP> Label<PP> of(String name, Class<PP> payloadType) {
		if (name.isEmpty()) {
			throw new IllegalArgumentException("Label name can't be empty");
		} else if (SUCCESS_NAME.equals(name)) {
			throw new ReservedLabelException("Label name \"" + SUCCESS_NAME + "\" is reserved for success");
		} else if (payloadType.isPrimitive()) {
			Class<?> wrapped = MethodType.methodType(payloadType).wrap().returnType();
			throw new PayloadTypeException("Primitive payload types are not allowed; use boxed " + wrapped.getSimpleName() + " instead of primitive " + payloadType.getSimpleName());
		}
		return new Label<>(name, payloadType);
	}

	/**
	 * The label of the success slot. Package-private, so handlers and
	 * generators can't be registered under it.
	 */
	static Label<Object> success() {
		return SUCCESS;
	}

	boolean isSuccess() {
		return this == SUCCESS;
	}

	/**
	 * @throws PayloadTypeException if <code>payload</code> is not an instance of {@link #payloadType()}
	 */
	public P cast(Object payload) {
		if (!payloadType.isInstance(payload)) {
			throw new PayloadTypeException("Label \"" + name + "\" carries " + payloadType.getSimpleName()
				+ "; got " + payload.getClass().getSimpleName());
		}
		return payloadType.cast(payload);
	}

	@Override
	public String toString() {
		return name;
	}

	private static final Label<Object> SUCCESS = new Label<>(SUCCESS_NAME, Object.class);
}
