package works.polyfail.testing;

import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GenTest {

	@Test
	void sample_sameSeedSameValues() {
		Gen<Integer> gen = Gen.choose(0, 1000);
		assertEquals(gen.sample(99, 20), gen.sample(99, 20));
	}

	@Test
	void choose_staysInRange() {
		List<Integer> sample = Gen.choose(-3, 4).sample(1, 500);
		assertTrue(sample.stream().allMatch(i -> -3 <= i && i < 4), sample::toString);
		assertTrue(sample.contains(-3));
		assertTrue(sample.contains(3));
	}

	@Test
	void choose_fullWidthRange() {
		List<Integer> negatives = Gen.choose(Integer.MIN_VALUE, 0).sample(2, 200);
		assertTrue(negatives.stream().allMatch(i -> i < 0), negatives::toString);
		List<Integer> wide = Gen.choose(Integer.MIN_VALUE, Integer.MAX_VALUE).sample(2, 200);
		assertTrue(wide.stream().anyMatch(i -> i < 0), wide::toString);
		assertTrue(wide.stream().anyMatch(i -> i > 0), wide::toString);
	}

	@Test
	void choose_emptyRange_throws() {
		assertThrows(IllegalArgumentException.class, () -> Gen.choose(5, 5));
	}

	@Test
	void constantAndMap() {
		assertEquals("xx", Gen.constant("x").map(s -> s + s).generate(new Random(0)));
	}
}
