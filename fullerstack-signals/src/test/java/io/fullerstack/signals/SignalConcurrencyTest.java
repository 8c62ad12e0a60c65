package io.fullerstack.signals;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Thread-safety of registration, removal and dispatch.
 */
class SignalConcurrencyTest {

  private static final int THREADS = 8;

  private final ExecutorService executor = Executors.newFixedThreadPool ( THREADS );

  @AfterEach
  void tearDown () throws InterruptedException {
    executor.shutdownNow ();
    assertThat ( executor.awaitTermination ( 10, TimeUnit.SECONDS ) ).isTrue ();
  }

  @Test
  void shouldAssignDistinctIdentitiesUnderConcurrentAdds () throws Exception {
    Signal < Integer > signal = new Signal <> ( "concurrent-add" );
    int perThread = 500;
    CyclicBarrier start = new CyclicBarrier ( THREADS );
    List < Future < List < Slot < Integer > > > > futures = new ArrayList <> ();

    for ( int t = 0; t < THREADS; t++ ) {
      final int thread = t;
      futures.add ( executor.submit ( () -> {
        start.await ();
        List < Slot < Integer > > added = new ArrayList <> ();
        for ( int i = 0; i < perThread; i++ ) {
          added.add ( signal.add ( sender -> thread, i % 7 ) );
        }
        return added;
      } ) );
    }

    Set < Long > identities = new HashSet <> ();
    for ( Future < List < Slot < Integer > > > future : futures ) {
      List < Slot < Integer > > added = future.get ( 30, TimeUnit.SECONDS );
      // Each thread sees its own adds in increasing identity order
      for ( int i = 1; i < added.size (); i++ ) {
        assertThat ( added.get ( i ).identity () ).isGreaterThan ( added.get ( i - 1 ).identity () );
      }
      added.forEach ( slot -> identities.add ( slot.identity () ) );
    }

    int total = THREADS * perThread;
    assertThat ( identities ).hasSize ( total );
    assertThat ( signal.size () ).isEqualTo ( total );
    assertThat ( signal.slots () ).isSortedAccordingTo ( Slot.order ( false ) );
    assertThat ( signal.call ().values () ).hasSize ( total );
  }

  @Test
  void shouldNeverInvokeSlotTwiceOrSkipLiveSlotDuringChurn () throws Exception {
    Signal < Long > signal = new Signal <> ( "churn" );
    int stable = 50;
    for ( int i = 0; i < stable; i++ ) {
      final long token = i;
      signal.add ( sender -> token, i % 5, "stable" );
    }

    AtomicBoolean running = new AtomicBoolean ( true );
    AtomicInteger violations = new AtomicInteger ();
    CountDownLatch writersDone = new CountDownLatch ( THREADS / 2 );

    for ( int w = 0; w < THREADS / 2; w++ ) {
      executor.submit ( () -> {
        try {
          for ( int i = 0; i < 2_000; i++ ) {
            Slot < Long > slot = signal.add ( sender -> -1L, i % 5, "churn" );
            signal.delete ( slot );
          }
        } finally {
          writersDone.countDown ();
        }
        return null;
      } );
    }

    List < Future < ? > > readers = new ArrayList <> ();
    for ( int r = 0; r < THREADS / 2; r++ ) {
      readers.add ( executor.submit ( () -> {
        while ( running.get () ) {
          // Every stable slot exactly once, churn slots never match
          List < Long > values = signal.call ( "stable" ).values ();
          if ( values.size () != stable || new HashSet <> ( values ).size () != stable || values.contains ( -1L ) ) {
            violations.incrementAndGet ();
          }
          List < Slot < Long > > snapshot = signal.slots ();
          for ( int i = 1; i < snapshot.size (); i++ ) {
            if ( Slot.order ( false ).compare ( snapshot.get ( i - 1 ), snapshot.get ( i ) ) >= 0 ) {
              violations.incrementAndGet ();
            }
          }
        }
        return null;
      } ) );
    }

    assertThat ( writersDone.await ( 30, TimeUnit.SECONDS ) ).isTrue ();
    running.set ( false );
    for ( Future < ? > reader : readers ) {
      reader.get ( 30, TimeUnit.SECONDS );
    }

    assertThat ( violations.get () ).isZero ();
    assertThat ( signal.size () ).isEqualTo ( stable );
    assertThat ( signal.findByListener ( "churn" ) ).isEmpty ();
  }

  @Test
  void shouldDispatchInParallel () throws Exception {
    Signal < Void > signal = new Signal <> ( "parallel" );
    CountDownLatch bothInside = new CountDownLatch ( 2 );
    signal.add ( sender -> {
      bothInside.countDown ();
      try {
        // Returns only if another dispatch is running at the same time
        if ( !bothInside.await ( 10, TimeUnit.SECONDS ) ) {
          throw new IllegalStateException ( "dispatches were serialized" );
        }
      } catch ( InterruptedException e ) {
        Thread.currentThread ().interrupt ();
        throw new IllegalStateException ( e );
      }
      return null;
    } );

    Future < DispatchResult < Void > > first = executor.submit ( () -> signal.call ( "a" ) );
    Future < DispatchResult < Void > > second = executor.submit ( () -> signal.call ( "b" ) );

    assertThat ( first.get ( 30, TimeUnit.SECONDS ).completed () ).isTrue ();
    assertThat ( second.get ( 30, TimeUnit.SECONDS ).completed () ).isTrue ();
  }

  @Test
  void shouldAllowMutationWhileAnotherThreadIsInsideDispatch () throws Exception {
    Signal < String > signal = new Signal <> ( "blocked" );
    CountDownLatch entered = new CountDownLatch ( 1 );
    CountDownLatch release = new CountDownLatch ( 1 );
    signal.add ( sender -> {
      entered.countDown ();
      try {
        release.await ( 10, TimeUnit.SECONDS );
      } catch ( InterruptedException e ) {
        Thread.currentThread ().interrupt ();
      }
      return "slow";
    } );

    Future < DispatchResult < String > > inFlight = executor.submit ( () -> signal.call () );
    assertThat ( entered.await ( 10, TimeUnit.SECONDS ) ).isTrue ();

    Slot < String > added = signal.add ( sender -> "late" );
    assertThat ( signal.contains ( added ) ).isTrue ();
    release.countDown ();

    assertThat ( inFlight.get ( 30, TimeUnit.SECONDS ).values () ).containsExactly ( "slow" );
  }
}
