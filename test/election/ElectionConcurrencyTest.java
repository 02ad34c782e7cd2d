package election;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import utility.GroupParameters;
import utility.SchnorrProof;
import utility.VoteAggregator;

public class ElectionConcurrencyTest {

    private static final List<String> CANDIDATES = Arrays.asList("a", "b", "c", "d");
    private static final int VOTERS = 8;

    private final GroupParameters group = GroupParameters.rfc3526();
    private ExecutorService pool;

    @Before
    public void setUp() {
        pool = Executors.newFixedThreadPool(4);
    }

    @After
    public void tearDown() {
        pool.shutdownNow();
    }

    @Test
    public void testConcurrentRegistrationsAndVotes() throws Exception {
        List<String> roster = new ArrayList<>();
        for (int i = 0; i < VOTERS; i++) {
            roster.add("voter" + i);
        }
        final Election election = Election.create(new ElectionConfig(CANDIDATES, roster, group)).orElseThrow();
        final int slotWidth = election.getConfig().getSlotWidth();
        assertEquals(3, slotWidth);

        // proofs are built up front so that the threads race on the election only
        List<Callable<ElectionResult<Round>>> registrations = new ArrayList<>();
        for (final String id : roster) {
            final SchnorrProof proof = new Voter(id, group).registrationProof();
            registrations.add(new Callable<ElectionResult<Round>>() {
                @Override
                public ElectionResult<Round> call() {
                    return election.submitPublicKey(id, proof);
                }
            });
        }
        for (Future<ElectionResult<Round>> done : pool.invokeAll(registrations)) {
            assertTrue(done.get().isSuccess());
        }
        assertEquals(VOTERS, election.getRegistrationCount());
        assertEquals(Round.VOTING, election.getRound());

        // each voter votes twice at once: exactly one ballot per voter must land
        List<Callable<ElectionResult<Round>>> ballots = new ArrayList<>();
        for (int i = 0; i < VOTERS; i++) {
            final String id = roster.get(i);
            final BigInteger vote = VoteAggregator.encodeVote(group, i % CANDIDATES.size(), slotWidth);
            for (int copy = 0; copy < 2; copy++) {
                ballots.add(new Callable<ElectionResult<Round>>() {
                    @Override
                    public ElectionResult<Round> call() {
                        return election.submitVote(id, vote);
                    }
                });
            }
        }
        int accepted = 0;
        for (Future<ElectionResult<Round>> done : pool.invokeAll(ballots)) {
            ElectionResult<Round> result = done.get();
            if (result.isSuccess()) {
                accepted++;
            } else {
                assertTrue(result.getError() == ElectionError.UNAUTHORIZED || result.getError() == ElectionError.WRONG_ROUND);
            }
        }
        assertEquals(VOTERS, accepted);
        assertEquals(Round.TALLY_PENDING, election.getRound());

        List<BigInteger> counts = Arrays.asList(BigInteger.valueOf(2), BigInteger.valueOf(2), BigInteger.valueOf(2), BigInteger.valueOf(2));
        assertTrue(election.resolveTally(counts).isSuccess());
        assertEquals("a", election.getWinner().getValue());
    }
}
