package election;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import utility.TallyResolver;

/**
 *
 * @author Nakamoteam
 */
public class ElectionDemo {

    private static final String CONFIG = "election.properties";

    // choice of the i-th voter on the roster, as an index into the candidate list
    private static final int[] CHOICES = {0, 1, 1, 2, 1};

    /**
     * @brief Runs a whole election on the configured roster: registration,
     * blinded voting, bounded search for the counts and public tally
     * @param args optional name of the configuration resource
     */
    public static void main(String[] args) throws ElectionException {
        String resource = args.length > 0 ? args[0] : CONFIG;
        ElectionConfig config = ElectionConfig.load(resource).orElseThrow();
        Election election = Election.create(config).orElseThrow();
        System.out.println("Election created SUCCESS: " + config);

        List<Voter> voters = new ArrayList<>();
        for (String id : config.getVoters()) {
            voters.add(new Voter(id, config.getGroup()));
        }

        // first round: every voter proves knowledge of its secret
        for (Voter voter : voters) {
            ElectionResult<Round> registered = voter.register(election);
            if (!registered.isSuccess()) {
                System.out.println("Registration of " + voter.getIdentity() + " ERROR: " + registered);
                return;
            }
            System.out.println("Registration of " + voter.getIdentity() + " SUCCESS");
        }
        System.out.println("--------------------          " + election.getRound());

        // second round: blinded ballots
        List<String> candidates = config.getCandidates();
        for (int i = 0; i < voters.size(); i++) {
            String choice = candidates.get(CHOICES[i % CHOICES.length] % candidates.size());
            ElectionResult<Round> voted = voters.get(i).vote(election, choice);
            if (!voted.isSuccess()) {
                System.out.println("Ballot of " + voters.get(i).getIdentity() + " ERROR: " + voted);
                return;
            }
            System.out.println("Ballot of " + voters.get(i).getIdentity() + " SUCCESS");
        }
        System.out.println("--------------------          " + election.getRound());

        // anyone can search the counts from the public aggregate and claim them
        BigInteger aggregate = election.getAggregate().orElseThrow();
        Optional<List<BigInteger>> counts = TallyResolver.recoverCounts(config.getGroup(), aggregate,
                candidates.size(), config.getSlotWidth(), election.getVoteCount());
        if (!counts.isPresent()) {
            System.out.println("Counts recovery ERROR");
            return;
        }
        ElectionResult<TallyResult> tally = election.resolveTally(counts.get());
        if (!tally.isSuccess()) {
            System.out.println("Tally ERROR: " + tally);
            return;
        }
        System.out.println("Tally SUCCESS: " + tally.getValue().getCounts());

        ElectionResult<String> winner = election.getWinner();
        System.out.println(winner.isSuccess() ? "Winner: " + winner.getValue() : "No winner: " + winner.getReason());
    }
}
