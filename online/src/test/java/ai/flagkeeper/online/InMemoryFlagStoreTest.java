package ai.flagkeeper.online;

public class InMemoryFlagStoreTest extends AbstractFlagStoreTest {

    @Override
    protected FlagStore createStore(TickingClock clock) {
        return new InMemoryFlagStore(clock);
    }
}
