package personal.reserve.core.raffle.adapter.out.random;

import org.springframework.stereotype.Component;
import personal.reserve.core.raffle.application.port.out.RandomSource;

import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Random;
import java.util.stream.Stream;

/**
 * Reservoir Random Source
 * 저수지 표본 추출 (Algorithm R): 모집단을 한 번 순회하며 k개만 유지
 * 모집단이 k개보다 작으면 전체를 반환
 */
@Component
public class ReservoirRandomSource implements RandomSource {

    private final Random random;

    public ReservoirRandomSource() {
        this(new SecureRandom());
    }

    ReservoirRandomSource(Random random) {
        this.random = random;
    }

    @Override
    public <T> List<T> sampleWithoutReplacement(Stream<T> population, int k) {
        if (k <= 0) {
            return List.of();
        }

        List<T> reservoir = new ArrayList<>(k);
        Iterator<T> iterator = population.iterator();
        long seen = 0;

        while (iterator.hasNext()) {
            T item = iterator.next();
            if (seen < k) {
                reservoir.add(item);
            } else {
                long slot = random.nextLong(seen + 1);
                if (slot < k) {
                    reservoir.set((int) slot, item);
                }
            }
            seen++;
        }
        return reservoir;
    }
}
