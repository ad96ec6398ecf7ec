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

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.junit.Test;
import trimkit.bus.EventHandler;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

public class EventHandlersTests {

	@Test
	public void handlersForTheSameReceiverAndMethodAreEqual() {
		Listener listener = new Listener();

		EventHandler<String> first = EventHandlers.method(listener, "onMessage", String.class);
		EventHandler<String> second = EventHandlers.method(listener, "onMessage", String.class);

		assertEquals(first, second);
		assertEquals(first.hashCode(), second.hashCode());
		assertThat(first, not(sameInstance(second)));
	}

	@Test
	public void handlersForDifferentReceiversOrMethodsAreNotEqual() {
		Listener listener = new Listener();

		EventHandler<String> handler = EventHandlers.method(listener, "onMessage", String.class);

		assertThat(handler, not(EventHandlers.method(new Listener(), "onMessage", String.class)));
		assertThat(handler, not(EventHandlers.method(listener, "onPayload", String.class)));
	}

	@Test
	public void senderAwareAndPayloadOnlyMethodsAreInvoked() {
		Listener listener = new Listener();
		Object sender = "sender";

		EventHandlers.method(listener, "onMessage", String.class).handle(sender, "hello");
		EventHandlers.method(listener, "onPayload", String.class).handle(sender, "world");

		assertThat(listener.calls, contains("onMessage(sender, hello)", "onPayload(world)"));
	}

	@Test
	public void methodsAcceptingASupertypeOfTheEventAreResolved() {
		Listener listener = new Listener();

		EventHandlers.method(listener, "onAnything", StringBuilder.class).handle(null, new StringBuilder("sb"));

		assertThat(listener.calls, contains("onAnything(sb)"));
	}

	@Test
	public void inheritedMethodsAreResolved() {
		Listener listener = new Listener() {
		};

		EventHandlers.method(listener, "onPayload", String.class).handle(null, "inherited");

		assertThat(listener.calls, contains("onPayload(inherited)"));
	}

	@Test
	public void staticMethodsAreResolved() {
		StaticListener.calls.clear();
		EventHandler<String> handler = EventHandlers.staticMethod(StaticListener.class, "onStatic", String.class);

		handler.handle(null, "static");

		assertThat(StaticListener.calls, contains("static"));
		assertEquals(handler, EventHandlers.staticMethod(StaticListener.class, "onStatic", String.class));
	}

	@Test(expected = IllegalArgumentException.class)
	public void unknownMethodsAreRejected() {
		EventHandlers.method(new Listener(), "onMissing", String.class);
	}

	@Test(expected = IllegalArgumentException.class)
	public void methodsNotAcceptingTheEventTypeAreRejected() {
		EventHandlers.method(new Listener(), "onMessage", Integer.class);
	}

	@Test(expected = IllegalStateException.class)
	public void uncheckedExceptionsPropagateUnwrapped() {
		EventHandlers.method(new Listener(), "onFailure", String.class).handle(null, "boom");
	}

	@Test
	public void checkedExceptionsAreWrapped() {
		try {
			EventHandlers.method(new Listener(), "onChecked", String.class).handle(null, "boom");
			fail("Expected HandlerInvocationException");
		} catch (HandlerInvocationException e) {
			assertThat(e.getCause(), instanceOf(IOException.class));
		}
	}

	static class Listener {
		final List<String> calls = new ArrayList<>();

		void onMessage(Object sender, String message) {
			calls.add("onMessage(" + sender + ", " + message + ")");
		}

		void onPayload(String payload) {
			calls.add("onPayload(" + payload + ")");
		}

		void onAnything(CharSequence value) {
			calls.add("onAnything(" + value + ")");
		}

		void onFailure(String message) {
			throw new IllegalStateException(message);
		}

		void onChecked(String message) throws IOException {
			throw new IOException(message);
		}
	}

	static final class StaticListener {
		static final List<String> calls = new ArrayList<>();

		static void onStatic(String value) {
			calls.add(value);
		}
	}

}
