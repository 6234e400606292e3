package org.metricshub.dumblang.ext;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * DumbLang
 * ჻჻჻჻჻჻
 * Copyright (C) 2006 - 2025 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.Objects;
import org.metricshub.dumblang.ext.annotations.DslFunction;
import org.metricshub.dumblang.jrt.IllegalDslArgumentException;
import org.metricshub.dumblang.jrt.Values;

/**
 * Metadata describing a single annotated extension function.
 */
public final class ExtensionFunction {

	private final String keyword;
	private final Class<? extends AbstractExtension> declaringType;
	private final Class<?>[] parameterTypes;
	private final Method method;
	private final int arity;
	private final boolean argumentOptional;

	ExtensionFunction(DslFunction annotation, Method methodParam) {
		this.keyword = validateKeyword(annotation.value(), methodParam);
		this.declaringType = resolveDeclaringType(methodParam);
		this.parameterTypes = methodParam.getParameterTypes();
		this.method = prepareMethod(methodParam);
		this.arity = parameterTypes.length;
		this.argumentOptional = annotation.argumentOptional() && arity == 1;
	}

	private static String validateKeyword(String keyword, Method method) {
		Objects.requireNonNull(method, "method");
		if (keyword == null || keyword.isEmpty()) {
			throw new IllegalStateException(
					"@" + DslFunction.class.getSimpleName()
							+ " on " + method + " must declare a non-empty name");
		}
		for (int i = 0; i < keyword.length(); i++) {
			char c = keyword.charAt(i);
			if (!((c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z'))) {
				throw new IllegalStateException(
						"@" + DslFunction.class.getSimpleName()
								+ " name '" + keyword + "' on " + method + " must consist of ASCII letters only");
			}
		}
		return keyword;
	}

	private static Class<? extends AbstractExtension> resolveDeclaringType(Method method) {
		Class<?> declaringClass = method.getDeclaringClass();
		if (!AbstractExtension.class.isAssignableFrom(declaringClass)) {
			throw new IllegalStateException(
					"@" + DslFunction.class.getSimpleName()
							+ " must be declared on a subclass of " + AbstractExtension.class.getName()
							+ ": " + method);
		}
		@SuppressWarnings("unchecked")
		Class<? extends AbstractExtension> type = (Class<? extends AbstractExtension>) declaringClass;
		return type;
	}

	private static Method prepareMethod(Method method) {
		if (Modifier.isStatic(method.getModifiers())) {
			throw new IllegalStateException(
					"@" + DslFunction.class.getSimpleName()
							+ " does not support static methods: " + method.toGenericString());
		}
		if (method.isVarArgs() || method.getParameterCount() > 1) {
			throw new IllegalStateException(
					"@" + DslFunction.class.getSimpleName()
							+ " methods take at most one parameter: " + method.toGenericString());
		}
		method.setAccessible(true);
		return method;
	}

	/**
	 * Returns the DumbLang name mapped to this extension function.
	 *
	 * @return the keyword exposed by the annotated method
	 */
	public String getKeyword() {
		return keyword;
	}

	/**
	 * Returns the extension type that declares the underlying Java method.
	 *
	 * @return declaring {@link AbstractExtension} subtype
	 */
	public Class<? extends AbstractExtension> getDeclaringType() {
		return declaringType;
	}

	/**
	 * @return number of parameters of the Java method, 0 or 1
	 */
	public int getArity() {
		return arity;
	}

	/**
	 * @return whether the function may be called without its argument
	 */
	public boolean isArgumentOptional() {
		return argumentOptional;
	}

	/**
	 * Invokes the underlying Java method on the supplied target instance.
	 *
	 * @param target extension instance to receive the call
	 * @param args arguments evaluated by the interpreter
	 * @return result of the Java invocation, converted to a runtime value
	 * @throws IllegalDslArgumentException when the arguments violate the metadata
	 * @throws IllegalStateException when reflection cannot invoke the method
	 */
	public Object invoke(DslExtension target, Object[] args) {
		Objects.requireNonNull(target, "target");
		if (!declaringType.isInstance(target)) {
			throw new IllegalArgumentException(
					"Extension instance " + target.getClass().getName()
							+ " is not compatible with " + declaringType.getName());
		}
		int argCount = args == null ? 0 : args.length;
		verifyArgCount(argCount);
		Object[] invocationArgs;
		if (arity == 0) {
			invocationArgs = new Object[0];
		} else {
			invocationArgs = new Object[] { argCount == 0 ? null : args[0] };
			verifyArgType(invocationArgs[0]);
		}
		try {
			return Values.normalize(method.invoke(target, invocationArgs));
		} catch (IllegalAccessException ex) {
			throw new IllegalStateException(
					"Unable to access extension function method for keyword '" + keyword + "'",
					ex);
		} catch (InvocationTargetException ex) {
			Throwable cause = ex.getCause();
			if (cause instanceof RuntimeException) {
				throw (RuntimeException) cause;
			}
			if (cause instanceof Error) {
				throw (Error) cause;
			}
			throw new IllegalStateException(
					"Invocation of extension function '" + keyword + "' failed",
					cause);
		}
	}

	/**
	 * Binds this function to an extension instance.
	 *
	 * @param target extension instance to receive the calls
	 * @return a builtin invoking this function on {@code target}
	 */
	public Builtin bindTo(DslExtension target) {
		Objects.requireNonNull(target, "target");
		return arguments -> invoke(target, arguments);
	}

	/**
	 * Verifies that the provided argument count satisfies the arity of the
	 * annotated method.
	 *
	 * @param argCount number of arguments the caller supplied
	 * @throws IllegalDslArgumentException when the count violates the signature
	 */
	public void verifyArgCount(int argCount) {
		if (argCount == arity || (argumentOptional && argCount == 0)) {
			return;
		}
		throw new IllegalDslArgumentException(
				"Extension function '" + keyword + "' expects " + arity
						+ " argument(s), not " + argCount);
	}

	private void verifyArgType(Object argument) {
		Class<?> parameterType = parameterTypes[0];
		if (argument != null && !parameterType.isPrimitive() && !parameterType.isInstance(argument)) {
			throw new IllegalDslArgumentException(
					"Argument passed to extension function '" + keyword + "' must be a "
							+ parameterType.getSimpleName() + ", not " + Values.typeName(argument));
		}
	}
}
