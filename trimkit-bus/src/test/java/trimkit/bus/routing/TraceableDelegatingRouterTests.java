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

package trimkit.bus.routing;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.slf4j.LoggerFactory;
import trimkit.bus.EventHandler;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

public class TraceableDelegatingRouterTests {

	private final ListAppender<ILoggingEvent> appender = new ListAppender<ILoggingEvent>();

	private Logger routerLog;
	private Level  previousLevel;

	@Before
	public void attachAppender() {
		routerLog = (Logger) LoggerFactory.getLogger(BroadcastRouter.class);
		previousLevel = routerLog.getLevel();
		routerLog.setLevel(Level.TRACE);
		appender.start();
		routerLog.addAppender(appender);
	}

	@After
	public void detachAppender() {
		routerLog.detachAppender(appender);
		routerLog.setLevel(previousLevel);
		appender.stop();
	}

	@Test
	public void routesToTheDelegateAndTracesTheEventPath() {
		List<String> calls = new ArrayList<>();
		List<EventHandler<?>> handlers = Arrays.<EventHandler<?>>asList(
		  (EventHandler<String>) (s, e) -> calls.add("first:" + e),
		  (EventHandler<String>) (s, e) -> calls.add("second:" + e));

		new TraceableDelegatingRouter(new BroadcastRouter()).route(null, "event", handlers);

		assertThat(calls, contains("first:event", "second:event"));
		assertEquals(2, appender.list.size());
		assertThat(appender.list.get(0).getFormattedMessage(), containsString("route(null, event"));
		assertThat(appender.list.get(1).getFormattedMessage(), containsString("routed event to 2 handler(s)"));
	}

	@Test
	public void failuresPropagateWithoutTheCompletionTrace() {
		List<EventHandler<?>> handlers = Arrays.<EventHandler<?>>asList(
		  (EventHandler<String>) (s, e) -> {
			  throw new IllegalStateException(e);
		  });

		try {
			new TraceableDelegatingRouter(new BroadcastRouter()).route(null, "boom", handlers);
			fail("Handler failure should have propagated");
		} catch (IllegalStateException e) {
			assertEquals("boom", e.getMessage());
		}
		assertEquals(1, appender.list.size());
	}

	@Test(expected = IllegalArgumentException.class)
	public void delegateIsRequired() {
		new TraceableDelegatingRouter(null);
	}

}
