package ca.gc.cra.curio.application.registry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.curio.domain.registry.Animal;
import ca.gc.cra.curio.domain.registry.Cat;
import ca.gc.cra.curio.domain.registry.Dog;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class AnimalRegistryTest {
  @Test
  void sortByTypeOrdersCatsBeforeDogsAndKeepsDogOrder() {
    try (AnimalRegistry registry = new AnimalRegistry()) {
      registry.add(new Dog("Rex"));
      registry.add(new Cat("Tom"));
      registry.add(new Dog("Fido"));

      registry.sortByType();

      assertEquals(List.of("Cat: Tom", "Dog: Rex", "Dog: Fido"), registry.displayAll());
    }
  }

  @Test
  void sortByTypeIsIdempotent() {
    try (AnimalRegistry registry = new AnimalRegistry()) {
      registry.add(new Dog("B"));
      registry.add(new Cat("A"));
      registry.add(new Dog("A"));
      registry.add(new Cat("B"));

      registry.sortByType();
      List<Animal> once = registry.snapshot();
      registry.sortByType();

      List<Animal> twice = registry.snapshot();
      for (int i = 0; i < once.size(); i++) {
        assertSame(once.get(i), twice.get(i));
      }
      assertEquals(List.of("Cat: A", "Cat: B", "Dog: B", "Dog: A"), registry.displayAll());
    }
  }

  @Test
  void removeByTypeRemovesEveryMatchAndKeepsOthersInOrder() {
    try (AnimalRegistry registry = new AnimalRegistry()) {
      registry.add(new Cat("Tom"));
      registry.add(new Dog("Rex"));
      registry.add(new Cat("Felix"));
      registry.add(new Dog("Fido"));

      assertEquals(2, registry.removeByType("Dog"));

      assertEquals(List.of("Cat: Tom", "Cat: Felix"), registry.displayAll());
    }
  }

  @Test
  void removeDogFromDogAndCatLeavesCat() {
    try (AnimalRegistry registry = new AnimalRegistry()) {
      registry.add(new Dog("Rex"));
      registry.add(new Cat("Tom"));

      registry.removeByType("Dog");

      assertEquals(List.of("Cat: Tom"), registry.displayAll());
    }
  }

  @Test
  void removeByTypeWithoutMatchesIsNoOp() {
    try (AnimalRegistry registry = new AnimalRegistry()) {
      registry.add(new Dog("Rex"));

      assertEquals(0, registry.removeByType("Parrot"));
      assertEquals(0, registry.removeByType("dog"));
      assertEquals(1, registry.size());
    }
  }

  @Test
  void displayInfoByTypeFiltersInCurrentOrder() {
    try (AnimalRegistry registry = new AnimalRegistry()) {
      registry.add(new Dog("Rex"));
      registry.add(new Cat("Tom"));
      registry.add(new Dog("Fido"));

      assertEquals(List.of("Rex is a Dog", "Fido is a Dog"), registry.displayInfoByType("Dog"));
      assertTrue(registry.displayInfoByType("Horse").isEmpty());
    }
  }

  @Test
  void sharedReferencesAreStoredNotCopied() {
    Animal rex = new Dog("Rex");
    try (AnimalRegistry registry = new AnimalRegistry()) {
      registry.add(rex);
      assertSame(rex, registry.snapshot().get(0));
    }
  }

  @Test
  void instanceCountTracksOpenRegistries() {
    int baseline = AnimalRegistry.instanceCount();
    List<AnimalRegistry> registries = new ArrayList<>();
    for (int i = 0; i < 3; i++) {
      registries.add(new AnimalRegistry());
    }
    assertEquals(baseline + 3, AnimalRegistry.instanceCount());

    registries.get(0).close();
    registries.get(0).close();
    assertEquals(baseline + 2, AnimalRegistry.instanceCount());

    registries.forEach(AnimalRegistry::close);
    assertEquals(baseline, AnimalRegistry.instanceCount());
  }
}
