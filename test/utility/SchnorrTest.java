package utility;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.math.BigInteger;
import java.security.SecureRandom;
import org.junit.Test;

public class SchnorrTest {

    private final GroupParameters group = GroupParameters.rfc3526();
    private final SecureRandom random = new SecureRandom();

    @Test
    public void testHonestProofVerifies() {
        BigInteger x = group.randomExponent(random);
        SchnorrProof proof = Schnorr.prove(group, x, "alice", random);
        assertEquals("Proof must carry g^x", group.exp(x), proof.getPk());
        assertTrue("Honest proof must verify", Schnorr.verify(group, proof, "alice"));
    }

    @Test
    public void testProofIsBoundToIdentity() {
        BigInteger x = group.randomExponent(random);
        SchnorrProof proof = Schnorr.prove(group, x, "alice", random);
        assertFalse("Replayed proof must not verify for another voter", Schnorr.verify(group, proof, "mallory"));
    }

    @Test
    public void testForgedProofWithoutSecretIsRejected() {
        BigInteger pk = group.exp(group.randomExponent(random));
        for (int i = 0; i < 10; i++) {
            BigInteger gv = group.exp(group.randomExponent(random));
            BigInteger r = group.randomExponent(random);
            assertFalse("Forgery " + i + " must not verify", Schnorr.verify(group, new SchnorrProof(pk, gv, r), "mallory"));
        }
    }

    @Test
    public void testProofWithWrongSecretIsRejected() {
        BigInteger x = group.randomExponent(random);
        SchnorrProof honest = Schnorr.prove(group, x, "alice", random);
        // proof made with another secret, presented with alice's public key
        SchnorrProof other = Schnorr.prove(group, x.add(BigInteger.ONE), "alice", random);
        assertFalse(Schnorr.verify(group, new SchnorrProof(honest.getPk(), other.getGv(), other.getR()), "alice"));
    }

    @Test
    public void testTamperedResponseIsRejected() {
        SchnorrProof proof = Schnorr.prove(group, group.randomExponent(random), "alice", random);
        SchnorrProof tampered = new SchnorrProof(proof.getPk(), proof.getGv(), proof.getR().add(BigInteger.ONE));
        assertFalse(Schnorr.verify(group, tampered, "alice"));
    }

    @Test
    public void testMalformedValuesAreRejected() {
        SchnorrProof proof = Schnorr.prove(group, group.randomExponent(random), "alice", random);
        assertFalse("pk = 0", Schnorr.verify(group, new SchnorrProof(BigInteger.ZERO, proof.getGv(), proof.getR()), "alice"));
        assertFalse("pk = p", Schnorr.verify(group, new SchnorrProof(group.getP(), proof.getGv(), proof.getR()), "alice"));
        assertFalse("negative r", Schnorr.verify(group, new SchnorrProof(proof.getPk(), proof.getGv(), proof.getR().negate()), "alice"));
    }
}
