package io.intellixity.semantiq.util;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class SemantiqFactoriesLoaderTest {
  public interface Greeting { String text(); }

  public interface Broken {}

  public interface Unregistered {}

  public static final class Hello implements Greeting {
    @Override public String text() { return "hello"; }
  }

  public static final class Hey implements Greeting {
    @Override public String text() { return "hey"; }
  }

  @Test
  void loadsRegisteredClassesOnceInOrder() {
    List<Greeting> found = SemantiqFactoriesLoader.load(Greeting.class);
    assertEquals(List.of("hello", "hey"), found.stream().map(Greeting::text).toList());
  }

  @Test
  void unregisteredTypeYieldsNothing() {
    assertTrue(SemantiqFactoriesLoader.load(Unregistered.class).isEmpty());
  }

  @Test
  void registrationOfWrongTypeIsRejected() {
    IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> SemantiqFactoriesLoader.load(Broken.class));
    assertTrue(e.getMessage().startsWith("java.lang.String registered in "));
  }
}
