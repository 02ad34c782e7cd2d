package election;

import java.io.IOException;
import java.io.InputStream;
import java.io.Serializable;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;
import utility.GroupParameters;
import utility.Utils;

/**
 * Everything the initializer hands to an election: candidates, roster,
 * field parameters and slot width. Checked by {@link Election#create}.
 *
 * @author Nakamoteam
 */
public class ElectionConfig implements Serializable {

    public static final String CANDIDATES = "election.candidates";
    public static final String VOTERS = "election.voters";
    public static final String GROUP = "election.group";
    public static final String MODULUS = "election.p";
    public static final String GENERATOR = "election.g";
    public static final String SLOT_WIDTH = "election.slotWidth";
    public static final String BALLOT_PROOF_REQUIRED = "election.ballotProofRequired";

    private static final String DEFAULT_GROUP = "rfc3526-2048";
    private static final String CUSTOM_GROUP = "custom";

    private final List<String> candidates;
    private final List<String> voters; // roster order fixes each voter's reconstructed key
    private final GroupParameters group;
    private final int slotWidth;
    private final boolean ballotProofRequired;

    public ElectionConfig(List<String> candidates, List<String> voters, GroupParameters group, int slotWidth,
            boolean ballotProofRequired) {
        this.candidates = Collections.unmodifiableList(new ArrayList<>(candidates));
        this.voters = Collections.unmodifiableList(new ArrayList<>(voters));
        this.group = group;
        this.slotWidth = slotWidth;
        this.ballotProofRequired = ballotProofRequired;
    }

    public ElectionConfig(List<String> candidates, List<String> voters, GroupParameters group) {
        this(candidates, voters, group, slotWidthFor(candidates.size()), false);
    }

    /**
     * @return the minimal m with 2^m > candidateCount >= 2^(m-1)
     */
    public static int slotWidthFor(int candidateCount) {
        return BigInteger.valueOf(candidateCount).bitLength();
    }

    /**
     * @brief Reads a configuration from the election.* keys
     */
    public static ElectionResult<ElectionConfig> fromProperties(Properties props) {
        List<String> candidates = splitList(props.getProperty(CANDIDATES));
        if (candidates.isEmpty()) {
            return ElectionResult.failure(ElectionError.INVALID_CONFIGURATION, CANDIDATES + " is missing or empty");
        }
        List<String> voters = splitList(props.getProperty(VOTERS));
        if (voters.isEmpty()) {
            return ElectionResult.failure(ElectionError.INVALID_CONFIGURATION, VOTERS + " is missing or empty");
        }

        GroupParameters group;
        String groupName = props.getProperty(GROUP, DEFAULT_GROUP).trim();
        if (DEFAULT_GROUP.equals(groupName)) {
            group = GroupParameters.rfc3526();
        } else if (CUSTOM_GROUP.equals(groupName)) {
            String p = props.getProperty(MODULUS);
            String g = props.getProperty(GENERATOR);
            if (p == null || g == null) {
                return ElectionResult.failure(ElectionError.INVALID_CONFIGURATION,
                        "custom group needs " + MODULUS + " and " + GENERATOR);
            }
            try {
                group = new GroupParameters(Utils.fromHex(p), Utils.fromHex(g));
            } catch (NumberFormatException e) {
                return ElectionResult.failure(ElectionError.INVALID_CONFIGURATION, "group parameters are not hex: " + e.getMessage());
            }
        } else {
            return ElectionResult.failure(ElectionError.INVALID_CONFIGURATION, "unknown group " + groupName);
        }

        int slotWidth;
        String width = props.getProperty(SLOT_WIDTH);
        if (width == null || width.trim().isEmpty()) {
            slotWidth = slotWidthFor(candidates.size());
        } else {
            try {
                slotWidth = Integer.parseInt(width.trim());
            } catch (NumberFormatException e) {
                return ElectionResult.failure(ElectionError.INVALID_CONFIGURATION, SLOT_WIDTH + " is not a number: " + width);
            }
        }

        boolean ballotProofRequired = Boolean.parseBoolean(props.getProperty(BALLOT_PROOF_REQUIRED, "false").trim());
        return ElectionResult.success(new ElectionConfig(candidates, voters, group, slotWidth, ballotProofRequired));
    }

    /**
     * @brief Loads a configuration from a classpath resource
     */
    public static ElectionResult<ElectionConfig> load(String resourceName) {
        Properties props = new Properties();
        try (InputStream in = ElectionConfig.class.getClassLoader().getResourceAsStream(resourceName)) {
            if (in == null) {
                return ElectionResult.failure(ElectionError.INVALID_CONFIGURATION, "resource not found: " + resourceName);
            }
            props.load(in);
        } catch (IOException e) {
            return ElectionResult.failure(ElectionError.INVALID_CONFIGURATION, "cannot read " + resourceName + ": " + e.getMessage());
        }
        return fromProperties(props);
    }

    private static List<String> splitList(String value) {
        List<String> items = new ArrayList<>();
        if (value == null) {
            return items;
        }
        for (String item : value.split(",")) {
            if (!item.trim().isEmpty()) {
                items.add(item.trim());
            }
        }
        return items;
    }

    public List<String> getCandidates() {
        return candidates;
    }

    public List<String> getVoters() {
        return voters;
    }

    public GroupParameters getGroup() {
        return group;
    }

    public int getSlotWidth() {
        return slotWidth;
    }

    public boolean isBallotProofRequired() {
        return ballotProofRequired;
    }

    @Override
    public String toString() {
        return "ElectionConfig{" + "candidates=" + candidates + ", voters=" + voters.size() + ", group=" + group
                + ", slotWidth=" + slotWidth + ", ballotProofRequired=" + ballotProofRequired + '}';
    }

}
