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

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import javax.annotation.Nullable;

import trimkit.bus.EventHandler;
import trimkit.core.util.Assert;

/**
 * {@link EventHandler} invoking a method on a receiver object. Two instances are equal when they invoke the same
 * {@link Method} on the same receiver instance, so registering a receiver's method twice is detected as a
 * duplicate no matter how many times the handler object was created.
 * <p>
 * The method takes either {@code (Object sender, T event)} or {@code (T event)}. Static methods have a {@code null}
 * receiver.
 *
 * @author Jon Brisbin
 * @see EventHandlers
 */
public final class MethodEventHandler<T> implements EventHandler<T> {

	private final Object  target;
	private final Method  method;
	private final boolean withSender;

	MethodEventHandler(@Nullable Object target, Method method) {
		Assert.notNull(method, "Method cannot be null.");
		this.target = target;
		this.method = method;
		this.withSender = method.getParameterCount() == 2;
	}

	@Nullable
	public Object getTarget() {
		return target;
	}

	public Method getMethod() {
		return method;
	}

	@Override
	public void handle(@Nullable Object sender, T event) {
		try {
			if (withSender) {
				method.invoke(target, sender, event);
			} else {
				method.invoke(target, event);
			}
		} catch (InvocationTargetException e) {
			Throwable cause = e.getCause();
			if (cause instanceof RuntimeException) {
				throw (RuntimeException) cause;
			}
			if (cause instanceof Error) {
				throw (Error) cause;
			}
			throw new HandlerInvocationException(method, cause);
		} catch (IllegalAccessException e) {
			throw new HandlerInvocationException(method, e);
		}
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof MethodEventHandler)) {
			return false;
		}
		MethodEventHandler<?> that = (MethodEventHandler<?>) o;
		return target == that.target && method.equals(that.method);
	}

	@Override
	public int hashCode() {
		return 31 * System.identityHashCode(target) + method.hashCode();
	}

	@Override
	public String toString() {
		return "MethodEventHandler{" +
		  "target=" + target +
		  ", method=" + method.getDeclaringClass().getSimpleName() + "#" + method.getName() +
		  '}';
	}
}
