package icu.wwj.benchmark.rmdb;

import icu.wwj.benchmark.rmdb.config.Configurations;

import java.util.Random;

/**
 * Random source of one terminal. Never shared between terminals.
 */
public class jTPCCRandom {
    
    private static final String[] C_LAST_SYLLABLES = {"BAR", "OUGHT", "ABLE", "PRI", "PRES", "ESE", "ANTI", "CALLY", "ATION", "EING"};
    
    private final Random random;
    
    private final int nURandCLast;
    
    private final int nURandCC_ID;
    
    private final int nURandCI_ID;
    
    public jTPCCRandom() {
        this(new Random());
    }
    
    public jTPCCRandom(long seed) {
        this(new Random(seed));
    }
    
    private jTPCCRandom(Random random) {
        this.random = random;
        // 2.1.6 run time constants C for NURand
        nURandCLast = nextInt(0, 1023);
        nURandCC_ID = nextInt(0, 1023);
        nURandCI_ID = nextInt(0, 8191);
    }
    
    /**
     * Uniform random int in [x, y].
     */
    public int nextInt(int x, int y) {
        return x + random.nextInt(y - x + 1);
    }
    
    /**
     * Uniform random long in [x, y].
     */
    public long nextLong(long x, long y) {
        return x + (long) (random.nextDouble() * (y - x + 1));
    }
    
    /**
     * Uniform random double in [0, 1).
     */
    public double nextDouble() {
        return random.nextDouble();
    }
    
    public int getCustomerID() {
        return nURand(1023, 1, Configurations.CUSTOMERS_PER_DISTRICT, nURandCC_ID);
    }
    
    public int getItemID() {
        return nURand(8191, 1, Configurations.ITEMS, nURandCI_ID);
    }
    
    /**
     * Last name of a randomly chosen customer.
     */
    public String getCLast() {
        return getCLast(nURand(1023, 1, Configurations.CUSTOMERS_PER_DISTRICT, nURandCLast));
    }
    
    /**
     * Last name the loader gives to a customer id.
     *
     * @param customerId customer id
     * @return last name
     */
    public static String getCLast(int customerId) {
        if (customerId < 1000) {
            return C_LAST_SYLLABLES[customerId / 100];
        }
        return C_LAST_SYLLABLES[customerId % 1000 / 100] + C_LAST_SYLLABLES[customerId / 1000];
    }
    
    private int nURand(int a, int x, int y, int c) {
        return (((nextInt(0, a) | nextInt(x, y)) + c) % (y - x + 1)) + x;
    }
}
