package org.folio.xmlstream.util.event;

import io.vertx.core.Handler;
import java.util.ArrayList;
import java.util.List;
import org.junit.Before;
import org.hamcrest.Matchers;
import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;

public class BootstrapsTest {
  protected Bootstraps bootstraps;
  protected List<Object> called;

  protected Bootstraps createBootstraps() {
    return new Bootstraps();
  }

  @Before
  public void setUpBootstraps() {
    bootstraps = createBootstraps();
    called = new ArrayList<>();
  }

  @Test
  public void installBootstraps() {
    Handler<Object> cb = called::add;
    EventDispatcher dispatcher = new EventDispatcher();
    bootstraps.addBootstrap("//event/myevent", cb);
    bootstraps.installBootstraps(dispatcher);

    dispatcher.dispatch("data", "//event/myevent");
    assertThat(called, Matchers.<Object>contains("data"));
  }

  @Test
  public void addAndRemoveBootstrap() {
    Handler<Object> cb = called::add;
    bootstraps.addBootstrap("//event/myevent", cb);
    bootstraps.removeBootstrap("//event/myevent", cb);

    EventDispatcher dispatcher = new EventDispatcher();
    bootstraps.installBootstraps(dispatcher);

    dispatcher.dispatch(null, "//event/myevent");
    assertThat(called, empty());
  }

  @Test
  public void removeMissingBootstrap() {
    Handler<Object> cb = called::add;
    bootstraps.addBootstrap("//event/myevent", cb);
    bootstraps.removeBootstrap("//event/other", cb);
    bootstraps.removeBootstrap("//event/myevent", x -> { });
    assertThat(bootstraps.getBootstraps(), hasSize(1));
  }

  @Test
  public void installOnSeveralTargets() {
    bootstraps.addBootstrap("a", x -> called.add("a1:" + x));
    bootstraps.addBootstrap("b", x -> called.add("b:" + x));
    bootstraps.addBootstrap("a", x -> called.add("a2:" + x));

    EventDispatcher d1 = new EventDispatcher();
    EventDispatcher d2 = new EventDispatcher();
    bootstraps.installBootstraps(d1);
    bootstraps.installBootstraps(d2);
    assertThat(bootstraps.getBootstraps(), hasSize(3));

    d1.dispatch(1, "a");
    d2.dispatch(2, "a");
    d2.dispatch(3, "b");
    assertThat(called, Matchers.<Object>contains("a1:1", "a2:1", "a1:2", "a2:2", "b:3"));
  }

  @Test
  public void installTwiceOnSameTarget() {
    bootstraps.addBootstrap("a", called::add);
    EventDispatcher dispatcher = new EventDispatcher();
    bootstraps.installBootstraps(dispatcher);
    bootstraps.installBootstraps(dispatcher);
    dispatcher.dispatch("x", "a");
    assertThat(called, hasSize(2));
  }

  @Test
  public void bootstrapsSnapshot() {
    Handler<Object> cb = called::add;
    bootstraps.addBootstrap("a", cb);
    assertThat(bootstraps.getBootstraps().get(0).getKey(), is("a"));
    assertThat(bootstraps.getBootstraps().get(0).getValue(), is(cb));
  }
}
