package election;

import java.io.Serializable;
import java.math.BigInteger;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import utility.TallyResolver;

/**
 * Verified counts of a closed election, in ballot order.
 *
 * @author Nakamoteam
 */
public class TallyResult implements Serializable {

    private final Map<String, BigInteger> counts;
    private final String winner; // null when every count is zero

    TallyResult(List<String> candidates, List<BigInteger> counts) {
        LinkedHashMap<String, BigInteger> map = new LinkedHashMap<>();
        for (int i = 0; i < candidates.size(); i++) {
            map.put(candidates.get(i), counts.get(i));
        }
        this.counts = Collections.unmodifiableMap(map);
        Optional<Integer> index = TallyResolver.selectWinner(counts);
        this.winner = index.isPresent() ? candidates.get(index.get()) : null;
    }

    public Map<String, BigInteger> getCounts() {
        return counts;
    }

    public Optional<String> getWinner() {
        return Optional.ofNullable(winner);
    }

    @Override
    public String toString() {
        return "TallyResult{" + "counts=" + counts + ", winner=" + winner + '}';
    }

}
