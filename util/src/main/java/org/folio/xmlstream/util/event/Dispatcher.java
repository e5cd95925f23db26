package org.folio.xmlstream.util.event;

import io.vertx.core.Handler;

/**
 * Registration and dispatch of observers keyed by event selector.
 *
 * <p>Selectors are plain strings matched exactly. Observers registered for the same
 * selector are invoked in registration order unless a priority says otherwise.
 */
public interface Dispatcher {

  /**
   * Register observer with default priority 0.
   * @param selector event selector
   * @param observer handler receiving the dispatched payload
   */
  default void addObserver(String selector, Handler<Object> observer) {
    addObserver(selector, observer, 0);
  }

  /**
   * Register observer. Higher priority observers run first; equal priorities run in
   * registration order. The same observer may be added more than once and is then
   * invoked once per registration.
   * @param selector event selector
   * @param observer handler receiving the dispatched payload
   * @param priority priority
   */
  void addObserver(String selector, Handler<Object> observer, int priority);

  /**
   * Register observer that is removed when it is invoked the first time.
   * @param selector event selector
   * @param observer handler receiving the dispatched payload
   */
  void addOnetimeObserver(String selector, Handler<Object> observer);

  /**
   * Remove first registration of observer for selector.
   *
   * <p>Removing an observer that is not registered is not an error; nothing happens.
   * @param selector event selector
   * @param observer handler to remove
   */
  void removeObserver(String selector, Handler<Object> observer);

  /**
   * Invoke all observers for selector, synchronously.
   *
   * <p>An exception thrown by an observer is propagated to the caller and
   * remaining observers are not invoked.
   * @param payload event payload; may be null
   * @param selector event selector
   */
  void dispatch(Object payload, String selector);
}
