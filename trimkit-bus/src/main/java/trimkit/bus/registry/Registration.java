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

/**
 * A {@link Registration} represents an object that has been {@link Registry#register(Object, Object) registered}
 * with a {@link Registry}. It can be cancelled at most once; later calls are no-ops.
 *
 * @param <K> the type of the key the object was registered under
 * @param <V> the type of object registered
 * @author Jon Brisbin
 * @author Stephane Maldini
 */
public interface Registration<K, V> extends AutoCloseable {

	/**
	 * The key that was used when the registration was made.
	 *
	 * @return the registration's key
	 */
	K getKey();

	/**
	 * The object that was registered
	 *
	 * @return the registered object
	 */
	V getObject();

	/**
	 * Cancel this {@literal Registration} by removing it from its registry. Only the first call, from whichever
	 * thread, removes anything.
	 *
	 * @return {@literal this}
	 */
	Registration<K, V> cancel();

	/**
	 * Has this been cancelled?
	 *
	 * @return {@literal true} if this has been cancelled, {@literal false} otherwise.
	 */
	boolean isCancelled();

	/**
	 * Same as {@link #cancel()}, for use in try-with-resources blocks.
	 */
	@Override
	default void close() {
		cancel();
	}

}
