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

package trimkit.bus.registry;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class RegistrationTests {

	@Test
	public void registrationIsCancelledOnlyOnce() {
		CountingRegistry registry = new CountingRegistry();
		Registration<Object, Object> reg = registry.register("key", "alpha");

		assertFalse(reg.isCancelled());
		reg.cancel();
		reg.cancel();
		reg.close();

		assertTrue(reg.isCancelled());
		assertEquals(1, registry.unregisterCalls.get());
		assertEquals(0, registry.count("key"));
	}

	@Test
	public void concurrentCancelsUnregisterExactlyOnce() throws Exception {
		final int threads = 8;

		for (int round = 0; round < 200; round++) {
			final CountingRegistry registry = new CountingRegistry();
			final Registration<Object, Object> reg = registry.register("key", "alpha");
			final CyclicBarrier start = new CyclicBarrier(threads);
			final CountDownLatch done = new CountDownLatch(threads);

			for (int i = 0; i < threads; i++) {
				new Thread(new Runnable() {
					@Override
					public void run() {
						try {
							start.await();
							reg.cancel();
						} catch (Exception e) {
							throw new IllegalStateException(e);
						} finally {
							done.countDown();
						}
					}
				}).start();
			}

			assertTrue(done.await(10, TimeUnit.SECONDS));
			assertEquals(1, registry.unregisterCalls.get());
			assertEquals(0, registry.size());
		}
	}

	private static final class CountingRegistry extends KeyedRegistry<Object, Object> {

		private final AtomicInteger unregisterCalls = new AtomicInteger();

		@Override
		public boolean unregister(Object key, Object obj) {
			unregisterCalls.incrementAndGet();
			return super.unregister(key, obj);
		}
	}

}
