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

import java.util.Collections;
import java.util.Iterator;
import java.util.List;

import com.gs.collections.api.list.MutableList;
import com.gs.collections.impl.list.mutable.FastList;
import com.gs.collections.impl.map.mutable.UnifiedMap;
import trimkit.core.util.Assert;

/**
 * Implementation of {@link Registry} that keeps one ordered list per key, all guarded by a single monitor.
 * <p>
 * The monitor is only held for map lookups, list scans and snapshot copies. Callers receive snapshots from
 * {@link #select(Object)}, so invoking the selected objects happens without the lock and may freely call back into
 * the registry. A key whose list becomes empty is removed, which keeps {@link #size()} equal to the number of keys
 * that have at least one registration.
 *
 * @author Jon Brisbin
 * @author Stephane Maldini
 */
public class KeyedRegistry<K, V> implements Registry<K, V> {

	private final Object                     monitor       = new Object();
	private final UnifiedMap<K, FastList<V>> registrations = UnifiedMap.newMap();

	KeyedRegistry() {
	}

	@Override
	public Registration<K, V> register(K key, V obj) {
		Assert.notNull(key, "Key cannot be null.");
		Assert.notNull(obj, "Handler cannot be null.");

		synchronized (monitor) {
			FastList<V> regs = registrations.getIfAbsentPut(key, FastList::new);
			// a freshly created list is empty, so a duplicate never leaves an empty list behind
			if (regs.contains(obj)) {
				throw new DuplicateSubscriptionException(key);
			}
			regs.add(obj);
		}

		return new OneShotRegistration<>(this, key, obj);
	}

	@Override
	public boolean unregister(K key, V obj) {
		Assert.notNull(key, "Key cannot be null.");
		Assert.notNull(obj, "Handler cannot be null.");

		synchronized (monitor) {
			FastList<V> regs = registrations.get(key);
			if (null == regs) {
				return false;
			}
			boolean removed = regs.remove(obj);
			if (regs.isEmpty()) {
				registrations.remove(key);
			}
			return removed;
		}
	}

	@Override
	public List<V> select(K key) {
		synchronized (monitor) {
			FastList<V> regs = registrations.get(key);
			if (null == regs || regs.isEmpty()) {
				return Collections.emptyList();
			}
			return FastList.newList(regs).asUnmodifiable();
		}
	}

	@Override
	public int count(K key) {
		synchronized (monitor) {
			FastList<V> regs = registrations.get(key);
			return (null == regs ? 0 : regs.size());
		}
	}

	@Override
	public int size() {
		synchronized (monitor) {
			return registrations.size();
		}
	}

	@Override
	public void clear() {
		synchronized (monitor) {
			registrations.clear();
		}
	}

	@Override
	public Iterator<V> iterator() {
		MutableList<V> all = FastList.newList();
		synchronized (monitor) {
			for (FastList<V> regs : registrations.values()) {
				all.addAll(regs);
			}
		}
		return all.asUnmodifiable().iterator();
	}

	@Override
	public String toString() {
		synchronized (monitor) {
			return "KeyedRegistry{" +
			  "registrations=" + registrations +
			  '}';
		}
	}

}
