package personal.reserve.core.raffle.application.port.out;

import java.util.List;
import java.util.stream.Stream;

/**
 * Random Source (Output Port)
 */
public interface RandomSource {

    /**
     * 모집단에서 k개를 비복원 균등 추출
     * 모집단 크기와 무관하게 k개만 메모리에 유지
     */
    <T> List<T> sampleWithoutReplacement(Stream<T> population, int k);
}
