package ca.gc.cra.curio.domain.registry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotSame;

import org.junit.jupiter.api.Test;

class AnimalTest {
  @Test
  void displayAndInfoIncludeTypeAndName() {
    Animal rex = new Dog("Rex");
    assertEquals("Dog: Rex", rex.display());
    assertEquals("Rex is a Dog", rex.info());
    assertEquals("Cat: Tom", new Cat("Tom").display());
  }

  @Test
  void copyKeepsVariantAndNameButIsIndependent() {
    Animal tom = new Cat("Tom");
    Animal copy = tom.copy();

    assertNotSame(tom, copy);
    assertInstanceOf(Cat.class, copy);
    assertEquals(tom, copy);
    assertEquals("Cat", copy.type());
  }
}
