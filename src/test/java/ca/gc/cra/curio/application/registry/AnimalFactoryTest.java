package ca.gc.cra.curio.application.registry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.curio.domain.registry.Animal;
import ca.gc.cra.curio.domain.registry.Cat;
import ca.gc.cra.curio.domain.registry.Dog;
import org.junit.jupiter.api.Test;

class AnimalFactoryTest {
  @Test
  void createAnimalReportsRequestedType() {
    assertEquals("Dog", AnimalFactory.createAnimal("Dog", "Rex").type());
    assertEquals("Cat", AnimalFactory.createAnimal("cat", "Tom").type());
  }

  @Test
  void unknownTypeFailsAndLeavesRegistryUnchanged() {
    try (AnimalRegistry registry = new AnimalRegistry()) {
      UnknownAnimalTypeException ex = assertThrows(UnknownAnimalTypeException.class,
          () -> registry.add(AnimalFactory.createAnimal("Parrot", "Polly")));
      assertEquals("Parrot", ex.typeTag());
      assertEquals(0, registry.size());
    }
  }

  @Test
  void abstractFactoriesProduceTheirVariant() {
    Animal dog = new DogFactory().create("Rex");
    Animal cat = new CatFactory().create("Tom");

    assertInstanceOf(Dog.class, dog);
    assertInstanceOf(Cat.class, cat);
    assertInstanceOf(CatFactory.class, AnimalFactory.creatorFor("CAT"));
  }
}
