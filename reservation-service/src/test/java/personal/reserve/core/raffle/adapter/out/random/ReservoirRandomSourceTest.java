package personal.reserve.core.raffle.adapter.out.random;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.stream.LongStream;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ReservoirRandomSource 단위 테스트")
class ReservoirRandomSourceTest {

    private final ReservoirRandomSource randomSource = new ReservoirRandomSource(new Random(42));

    @Test
    @DisplayName("모집단에서 중복 없이 k개를 고른다")
    void sample_DistinctK() {
        // when
        List<Long> sample = randomSource.sampleWithoutReplacement(LongStream.rangeClosed(1, 1000).boxed(), 25);

        // then
        assertThat(sample).hasSize(25).doesNotHaveDuplicates();
        assertThat(sample).allMatch(id -> id >= 1 && id <= 1000);
    }

    @Test
    @DisplayName("모집단이 k보다 작으면 전체를 반환한다")
    void sample_PopulationSmallerThanK() {
        assertThat(randomSource.sampleWithoutReplacement(Stream.of(1L, 2L, 3L), 5))
                .containsExactlyInAnyOrder(1L, 2L, 3L);
    }

    @Test
    @DisplayName("k가 0이면 빈 목록을 반환한다")
    void sample_Zero() {
        assertThat(randomSource.sampleWithoutReplacement(Stream.of(1L, 2L), 0)).isEmpty();
    }

    @Test
    @DisplayName("모든 원소가 고르게 선택된다")
    void sample_Uniform() {
        // given
        Map<Long, Integer> hits = new HashMap<>();
        int trials = 20_000;

        // when
        for (int i = 0; i < trials; i++) {
            randomSource.sampleWithoutReplacement(LongStream.rangeClosed(1, 10).boxed(), 3)
                    .forEach(id -> hits.merge(id, 1, Integer::sum));
        }

        // then: 기대값 6000 (= 20000 * 3 / 10)
        assertThat(hits).hasSize(10);
        assertThat(hits.values()).allMatch(count -> count > 5400 && count < 6600);
    }
}
