package election;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import utility.GroupParameters;
import utility.ModularArithmetic;

/**
 *
 * @author Nakamoteam
 */
class VoterRegistry {

    // Roster of the election: voter identity is the key, the VoterRecord is the value.
    // keyOwners is the reverse index from public key to identity and must stay injective.
    // Not synchronized: Election guards every call with its lock.

    private static class VoterRecord {

        private boolean eligible; // cleared when the vote is cast
        private BigInteger publicKey; // null until registration
        private BigInteger reconstructedKey; // null until the voting round opens

        public VoterRecord() {
            this.eligible = true;
            this.publicKey = null;
            this.reconstructedKey = null;
        }
    }

    private final LinkedHashMap<String, VoterRecord> records;
    private final HashMap<BigInteger, String> keyOwners;

    public VoterRegistry(List<String> voters) {
        records = new LinkedHashMap<>();
        for (String voter : voters) {
            records.put(voter, new VoterRecord());
        }
        keyOwners = new HashMap<>();
    }

    public int size() {
        return records.size();
    }

    public boolean contains(String voterId) {
        return voterId != null && records.containsKey(voterId);
    }

    public boolean isRegistered(String voterId) {
        VoterRecord record = records.get(voterId);
        return record != null && record.publicKey != null;
    }

    public boolean isEligible(String voterId) {
        VoterRecord record = records.get(voterId);
        return record != null && record.eligible;
    }

    /**
     * @return the identity that registered pk, or null
     */
    public String ownerOf(BigInteger pk) {
        return keyOwners.get(pk);
    }

    public BigInteger getPublicKey(String voterId) {
        VoterRecord record = records.get(voterId);
        return record == null ? null : record.publicKey;
    }

    public BigInteger getReconstructedKey(String voterId) {
        VoterRecord record = records.get(voterId);
        return record == null ? null : record.reconstructedKey;
    }

    public void bindKey(String voterId, BigInteger pk) {
        records.get(voterId).publicKey = pk;
        keyOwners.put(pk, voterId);
    }

    public void consumeEligibility(String voterId) {
        records.get(voterId).eligible = false;
    }

    /**
     * @brief Computes Y_i = prod_{k<i} pk_k / prod_{k>i} pk_k mod p for every
     * voter, in roster order. Called once, when every voter has registered.
     */
    public void computeReconstructedKeys(GroupParameters group) {
        BigInteger p = group.getP();
        List<VoterRecord> ordered = new ArrayList<>(records.values());
        int size = ordered.size();

        BigInteger[] suffix = new BigInteger[size + 1]; // suffix[i] = prod_{k>=i} pk_k
        suffix[size] = BigInteger.ONE;
        for (int i = size - 1; i >= 0; i--) {
            suffix[i] = ModularArithmetic.mulMod(suffix[i + 1], ordered.get(i).publicKey, p);
        }

        BigInteger prefix = BigInteger.ONE; // prod_{k<i} pk_k
        for (int i = 0; i < size; i++) {
            VoterRecord record = ordered.get(i);
            record.reconstructedKey = ModularArithmetic.mulMod(prefix, ModularArithmetic.inverse(suffix[i + 1], p), p);
            prefix = ModularArithmetic.mulMod(prefix, record.publicKey, p);
        }
    }

    public Map<String, BigInteger> publicKeys() {
        LinkedHashMap<String, BigInteger> keys = new LinkedHashMap<>();
        for (Map.Entry<String, VoterRecord> entry : records.entrySet()) {
            keys.put(entry.getKey(), entry.getValue().publicKey);
        }
        return Collections.unmodifiableMap(keys);
    }

}
