package org.surff.pool;

import org.junit.Test;
import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Unit tests for JobChannel.
 */
public class JobChannelTest {

    @Test
    public void testMessagesArriveInSendOrder() {
        JobChannel channel = JobChannel.open();
        List<Job> jobs = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            Job job = new TaggedJob(i);
            jobs.add(job);
            channel.sender().send(Message.job(job));
        }
        channel.sender().send(Message.terminate());

        for (Job job : jobs) {
            Message message = channel.receiver().recv();
            assertTrue(message instanceof Message.NewJob);
            assertSame(job, ((Message.NewJob) message).job());
        }
        assertSame(Message.Terminate.INSTANCE, channel.receiver().recv());
        assertEquals(0, channel.receiver().pending());
    }

    @Test
    public void testRecvBlocksUntilMessageSent() throws Exception {
        JobChannel channel = JobChannel.open();
        AtomicReference<Message> received = new AtomicReference<>();
        CountDownLatch done = new CountDownLatch(1);

        Thread receiver = new Thread(() -> {
            received.set(channel.receiver().recv());
            done.countDown();
        });
        receiver.start();

        assertFalse(done.await(100, TimeUnit.MILLISECONDS));
        channel.sender().send(Message.terminate());
        assertTrue(done.await(5, TimeUnit.SECONDS));
        assertSame(Message.Terminate.INSTANCE, received.get());
        receiver.join();
    }

    @Test
    public void testQueuedMessagesSurviveSenderClose() {
        JobChannel channel = JobChannel.open();
        channel.sender().send(Message.job(() -> {}));
        channel.sender().send(Message.terminate());
        channel.sender().close();

        assertTrue(channel.receiver().recv() instanceof Message.NewJob);
        assertSame(Message.Terminate.INSTANCE, channel.receiver().recv());
        try {
            channel.receiver().recv();
            fail("expected disconnect");
        } catch (ChannelDisconnectedException expected) {
            // queue drained and no sender left
        }
    }

    @Test(expected = ChannelDisconnectedException.class)
    public void testSendOnClosedSenderFails() {
        JobChannel channel = JobChannel.open();
        channel.sender().close();
        channel.sender().send(Message.terminate());
    }

    @Test
    public void testCopyKeepsChannelConnected() throws Exception {
        JobChannel channel = JobChannel.open();
        JobChannel.Sender second = channel.sender().copy();
        channel.sender().close();

        assertTrue(channel.sender().isClosed());
        assertFalse(second.isClosed());
        second.send(Message.terminate());
        assertSame(Message.Terminate.INSTANCE, channel.receiver().recv());

        CountDownLatch disconnected = new CountDownLatch(1);
        Thread waiter = new Thread(() -> {
            try {
                channel.receiver().recv();
            } catch (ChannelDisconnectedException e) {
                disconnected.countDown();
            }
        });
        waiter.start();

        assertFalse(disconnected.await(100, TimeUnit.MILLISECONDS));
        second.close();
        assertTrue(disconnected.await(5, TimeUnit.SECONDS));
        waiter.join();
    }

    @Test
    public void testParkedReceiversWakeOnDisconnect() throws Exception {
        JobChannel channel = JobChannel.open();
        int receivers = 4;
        CountDownLatch disconnected = new CountDownLatch(receivers);
        List<Thread> threads = new ArrayList<>();
        for (int i = 0; i < receivers; i++) {
            Thread t = new Thread(() -> {
                try {
                    channel.receiver().recv();
                } catch (ChannelDisconnectedException e) {
                    disconnected.countDown();
                }
            });
            threads.add(t);
            t.start();
        }

        Thread.sleep(50);
        channel.sender().close();
        assertTrue(disconnected.await(5, TimeUnit.SECONDS));
        for (Thread t : threads) {
            t.join();
        }
    }

    @Test
    public void testEachMessageDeliveredToOneReceiver() throws Exception {
        JobChannel channel = JobChannel.open();
        int receivers = 4;
        int messages = 10_000;
        Set<Job> seen = ConcurrentHashMap.newKeySet();
        AtomicInteger duplicates = new AtomicInteger();
        AtomicInteger total = new AtomicInteger();

        List<Thread> threads = new ArrayList<>();
        for (int i = 0; i < receivers; i++) {
            Thread t = new Thread(() -> {
                while (true) {
                    Message message = channel.receiver().recv();
                    if (!(message instanceof Message.NewJob)) return;
                    total.incrementAndGet();
                    if (!seen.add(((Message.NewJob) message).job())) {
                        duplicates.incrementAndGet();
                    }
                }
            });
            threads.add(t);
            t.start();
        }

        for (int i = 0; i < messages; i++) {
            channel.sender().send(Message.job(new TaggedJob(i)));
        }
        for (int i = 0; i < receivers; i++) {
            channel.sender().send(Message.terminate());
        }
        for (Thread t : threads) {
            t.join(10_000);
            assertFalse(t.isAlive());
        }

        assertEquals(messages, total.get());
        assertEquals(messages, seen.size());
        assertEquals(0, duplicates.get());
    }

    @Test(expected = NullPointerException.class)
    public void testNewJobRequiresJob() {
        Message.job(null);
    }

    private record TaggedJob(int tag) implements Job {
        @Override
        public void run() {}
    }
}
