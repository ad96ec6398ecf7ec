/*
 * Copyright (c) 2011-2016 Pivotal Software Inc, All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *       http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package trimkit.bus.support;

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;

import trimkit.bus.EventHandler;
import trimkit.core.util.Assert;

/**
 * Helper methods for building {@link EventHandler EventHandlers} with a stable (receiver, method) identity.
 *
 * @author Jon Brisbin
 */
public abstract class EventHandlers {

	private EventHandlers() {
	}

	/**
	 * Create a handler invoking the instance method {@code methodName} on {@code target}. The method must accept
	 * {@code (Object sender, T event)} or {@code (T event)}; the two-argument form is preferred when both exist.
	 *
	 * @param target     The receiver
	 * @param methodName The name of the method to invoke
	 * @param eventType  The event type the method handles
	 * @param <T>        The event type
	 * @return A new {@link MethodEventHandler}, equal to any other built for the same receiver and method
	 * @throws IllegalArgumentException if no matching method exists
	 */
	public static <T> EventHandler<T> method(Object target, String methodName, Class<T> eventType) {
		Assert.notNull(target, "Target cannot be null.");
		return new MethodEventHandler<T>(target, findMethod(target.getClass(), methodName, eventType, false));
	}

	/**
	 * Create a handler invoking the static method {@code methodName} declared by {@code owner} or one of its
	 * superclasses.
	 *
	 * @param owner      The class declaring the method
	 * @param methodName The name of the method to invoke
	 * @param eventType  The event type the method handles
	 * @param <T>        The event type
	 * @return A new {@link MethodEventHandler}, equal to any other built for the same method
	 * @throws IllegalArgumentException if no matching method exists
	 */
	public static <T> EventHandler<T> staticMethod(Class<?> owner, String methodName, Class<T> eventType) {
		Assert.notNull(owner, "Owner cannot be null.");
		return new MethodEventHandler<T>(null, findMethod(owner, methodName, eventType, true));
	}

	private static Method findMethod(Class<?> type, String methodName, Class<?> eventType, boolean isStatic) {
		Assert.notNull(methodName, "Method name cannot be null.");
		Assert.notNull(eventType, "Event type cannot be null.");

		Method singleArg = null;
		for (Class<?> c = type; null != c && c != Object.class; c = c.getSuperclass()) {
			for (Method m : c.getDeclaredMethods()) {
				if (!methodName.equals(m.getName())
				  || m.isBridge()
				  || Modifier.isStatic(m.getModifiers()) != isStatic) {
					continue;
				}
				Class<?>[] params = m.getParameterTypes();
				if (params.length == 2 && params[0] == Object.class && params[1].isAssignableFrom(eventType)) {
					m.setAccessible(true);
					return m;
				}
				if (params.length == 1 && params[0].isAssignableFrom(eventType) && null == singleArg) {
					singleArg = m;
				}
			}
		}
		if (null == singleArg) {
			throw new IllegalArgumentException("No " + (isStatic ? "static" : "instance") + " method " +
			  type.getName() + "#" + methodName + " accepting " + eventType.getName() + " found.");
		}
		singleArg.setAccessible(true);
		return singleArg;
	}

}
