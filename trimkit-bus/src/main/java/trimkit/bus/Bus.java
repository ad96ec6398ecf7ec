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

package trimkit.bus;

/**
 * Basic unit of event handling in Trimkit: handlers subscribe to an event type, publishers notify them.
 *
 * @author Jon Brisbin
 * @author Stephane Maldini
 * @author Andy Wilkinson
 */
public interface Bus extends Subscribable, Unsubscribable, Publishable {

	/**
	 * @param type The event type
	 * @return the number of handlers currently subscribed to {@code type}
	 */
	int getSubscriberCount(Class<?> type);

	/**
	 * Are there any handlers subscribed to the given {@code type}.
	 *
	 * @param type The event type
	 * @return {@literal true} if there is at least one handler, {@literal false} otherwise
	 */
	boolean respondsTo(Class<?> type);

	/**
	 * Remove every subscription. Registrations obtained before the reset become inert.
	 */
	void reset();

}
