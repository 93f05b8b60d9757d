package com.e2eq.access.policy.script.js;

import com.e2eq.access.config.PolicyEngineConfig;
import com.e2eq.access.model.context.PolicyContext;
import com.e2eq.access.model.decision.AccessDecision;
import com.e2eq.access.model.json.JSONUtils;
import com.e2eq.access.model.policy.ScriptLanguage;
import com.e2eq.access.policy.script.PolicyScriptEngine;
import com.e2eq.access.policy.script.ScriptAbortException;
import com.e2eq.access.policy.script.ScriptBindings;
import com.e2eq.access.policy.script.ScriptExecutionException;
import com.e2eq.access.policy.script.ScriptMemoryLimitException;
import com.e2eq.access.policy.script.ScriptResourceExceededException;
import com.e2eq.access.policy.script.ScriptResults;
import com.e2eq.access.policy.script.ScriptSlotUnavailableException;
import com.e2eq.access.policy.script.ScriptTimeoutException;
import com.e2eq.access.util.Deadline;
import com.fasterxml.jackson.core.JsonProcessingException;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.graalvm.polyglot.Context;
import org.graalvm.polyglot.Engine;
import org.graalvm.polyglot.HostAccess;
import org.graalvm.polyglot.PolyglotException;
import org.graalvm.polyglot.ResourceLimits;
import org.graalvm.polyglot.Value;
import org.jboss.logging.Logger;

import java.lang.management.ManagementFactory;
import java.lang.management.ThreadMXBean;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs JavaScript policies on GraalJS. A fixed number of slots, each owning a polyglot
 * {@link Engine} and one worker thread, are created on demand and checked out per
 * execution. Every execution gets a new {@link Context} with no host access beyond
 * {@link ScriptConsole}, so no script state survives into the next run.
 * <p>
 * The caller waits on the worker and cancels the context when the deadline passes or
 * the worker thread has allocated more than the configured allocation budget. The
 * budget counts every byte allocated during the run, including garbage, so it bounds
 * allocation churn rather than the heap a script retains.
 */
@ApplicationScoped
public class JavaScriptEngine implements PolicyScriptEngine {

   private static final Logger LOG = Logger.getLogger(JavaScriptEngine.class);

   static final String LANGUAGE_ID = "js";
   private static final long MONITOR_INTERVAL_MILLIS = 5;
   private static final long CANCEL_GRACE_MILLIS = 1000;

   private static final String WRAPPER_HEAD = String.join("\n",
           "(function(__ctxJson, __console) {",
           "  'use strict';",
           "  const __freeze = (o) => {",
           "    if (o !== null && typeof o === 'object' && !Object.isFrozen(o)) {",
           "      Object.freeze(o);",
           "      Object.getOwnPropertyNames(o).forEach((k) => __freeze(o[k]));",
           "    }",
           "    return o;",
           "  };",
           "  const ctx = __freeze(JSON.parse(__ctxJson));",
           "  const user = ctx.user, client = ctx.client, request = ctx.request,",
           "        scopes = ctx.scopes, environment = ctx.environment, resource = ctx.resource;",
           "  const __text = (args) => args.map((a) => typeof a === 'string' ? a : JSON.stringify(a)).join(' ');",
           "  const console = Object.freeze({",
           "    log: (...a) => __console.log('info', __text(a)),",
           "    info: (...a) => __console.log('info', __text(a)),",
           "    debug: (...a) => __console.log('debug', __text(a)),",
           "    warn: (...a) => __console.log('warn', __text(a)),",
           "    error: (...a) => __console.log('error', __text(a))",
           "  });",
           "  const allow = () => ({ decision: 'allow' });",
           "  const deny = (reason) => ({ decision: 'deny', reason: reason || 'Access denied' });",
           "  const abstain = () => ({ decision: 'abstain' });",
           "  const hasRole = (role) => !!user && Array.isArray(user.roles) && user.roles.includes(role);",
           "  const hasAnyRole = (...roles) => roles.some(hasRole);",
           "  const isPatientUser = () => !!user && user.fhirUserType === 'Patient';",
           "  const isPractitionerUser = () => !!user && user.fhirUserType === 'Practitioner';",
           "  const getPatientContext = () => environment.patientContext || null;",
           "  const getEncounterContext = () => environment.encounterContext || null;",
           "  const inPatientCompartment = () => {",
           "    const patient = getPatientContext();",
           "    if (!patient || !resource || !resource.subject) { return false; }",
           "    return resource.subject === `Patient/${patient}` || resource.subject.endsWith(`/${patient}`);",
           "  };",
           "  return (function() {",
           "");

   private static final String WRAPPER_TAIL = "\n  })();\n})";

   private final Duration timeout;
   private final Duration checkoutTimeout;
   private final int poolSize;
   private final long allocationLimitBytes;
   private final long stackSizeBytes;
   private final long statementLimit;

   private final BlockingQueue<Slot> idle;
   private final List<Slot> slots = new ArrayList<>();
   private final AtomicInteger created = new AtomicInteger();
   private volatile boolean closed;

   @Inject
   public JavaScriptEngine(PolicyEngineConfig config) {
      this(config.script().javascriptTimeout(),
              config.script().checkoutTimeout(),
              config.script().poolSize().orElse(Runtime.getRuntime().availableProcessors()),
              config.script().allocationLimitBytes(),
              config.script().stackSizeBytes(),
              config.script().statementLimit());
   }

   public JavaScriptEngine(Duration timeout, Duration checkoutTimeout, int poolSize, long allocationLimitBytes,
                           long stackSizeBytes, long statementLimit) {
      if (poolSize < 1) {
         throw new IllegalArgumentException("JavaScript pool size must be at least 1, was " + poolSize);
      }
      this.timeout = timeout;
      this.checkoutTimeout = checkoutTimeout;
      this.poolSize = poolSize;
      this.allocationLimitBytes = allocationLimitBytes;
      this.stackSizeBytes = stackSizeBytes;
      this.statementLimit = statementLimit;
      this.idle = new ArrayBlockingQueue<>(poolSize);
   }

   @Override
   public ScriptLanguage language() {
      return ScriptLanguage.JAVASCRIPT;
   }

   @Override
   public Duration timeout() {
      return timeout;
   }

   public int poolSize() {
      return poolSize;
   }

   /**
    * Slots started so far; at most {@link #poolSize()}.
    */
   public int startedSlots() {
      return created.get();
   }

   @Override
   public AccessDecision evaluate(String script, PolicyContext context, Deadline deadline) throws ScriptAbortException {
      String contextJson;
      try {
         contextJson = JSONUtils.instance().toJson(ScriptBindings.of(context));
      } catch (JsonProcessingException e) {
         throw new ScriptExecutionException("Unable to pass the request context to the script", e);
      }

      long budgetMillis = ScriptTimeoutException.budgetMillis(timeout, deadline);
      Deadline effective = deadline.limitedTo(timeout);
      Slot slot = checkout(effective);
      boolean healthy = true;
      try {
         return slot.run(script, contextJson, effective, budgetMillis);
      } catch (SlotStuckException e) {
         healthy = false;
         throw e.abort;
      } finally {
         release(slot, healthy);
      }
   }

   private Slot checkout(Deadline deadline) {
      if (closed) {
         throw new ScriptSlotUnavailableException("JavaScript engine is shut down");
      }
      Slot slot = idle.poll();
      if (slot != null) {
         return slot;
      }
      slot = startSlotIfBelowCapacity();
      if (slot != null) {
         return slot;
      }
      long waitMillis = Math.min(checkoutTimeout.toMillis(), deadline.remainingMillis());
      try {
         slot = idle.poll(waitMillis, TimeUnit.MILLISECONDS);
      } catch (InterruptedException e) {
         Thread.currentThread().interrupt();
         throw new ScriptSlotUnavailableException("Interrupted while waiting for a JavaScript slot");
      }
      if (slot == null) {
         throw new ScriptSlotUnavailableException("All " + poolSize + " JavaScript slots busy for " + waitMillis + " ms");
      }
      return slot;
   }

   private Slot startSlotIfBelowCapacity() {
      while (true) {
         int count = created.get();
         if (count >= poolSize) {
            return null;
         }
         if (created.compareAndSet(count, count + 1)) {
            Slot slot = new Slot(count);
            synchronized (slots) {
               slots.add(slot);
            }
            LOG.debugf("Started JavaScript slot %d of %d", count + 1, poolSize);
            return slot;
         }
      }
   }

   private void release(Slot slot, boolean healthy) {
      if (healthy && !closed) {
         idle.offer(slot);
         return;
      }
      if (!healthy) {
         LOG.warnf("Replacing JavaScript slot %d after a run that could not be cancelled", slot.index);
      }
      slot.close();
      synchronized (slots) {
         slots.remove(slot);
      }
      created.decrementAndGet();
   }

   @PreDestroy
   @Override
   public void close() {
      closed = true;
      synchronized (slots) {
         slots.forEach(Slot::close);
         slots.clear();
      }
      idle.clear();
   }

   private static final class SlotStuckException extends RuntimeException {
      final transient ScriptAbortException abort;

      SlotStuckException(ScriptAbortException abort) {
         super(abort.getMessage(), abort, false, false);
         this.abort = abort;
      }
   }

   private enum Abort {
      NONE,
      TIMEOUT,
      MEMORY
   }

   /**
    * One polyglot engine plus the thread every context of that engine runs on.
    */
   private final class Slot {
      final int index;
      final Engine engine;
      final ExecutorService worker;
      final ResourceLimits limits;
      final AtomicReference<Thread> workerThread = new AtomicReference<>();

      Slot(int index) {
         this.index = index;
         this.engine = Engine.newBuilder().build();
         this.limits = ResourceLimits.newBuilder().statementLimit(statementLimit, null).build();
         this.worker = Executors.newSingleThreadExecutor(r -> {
            Thread th = new Thread(null, r, "policy-script-js-" + index, stackSizeBytes);
            th.setDaemon(true);
            workerThread.set(th);
            return th;
         });
      }

      AccessDecision run(String script, String contextJson, Deadline deadline, long budgetMillis) {
         AtomicReference<Context> running = new AtomicReference<>();
         AtomicReference<Abort> abort = new AtomicReference<>(Abort.NONE);

         Future<AccessDecision> fut = worker.submit(() -> {
            try (Context c = newContext()) {
               running.set(c);
               Value fn = c.eval(LANGUAGE_ID, WRAPPER_HEAD + script + WRAPPER_TAIL);
               return toDecision(fn.execute(contextJson, ScriptConsole.INSTANCE));
            } finally {
               running.set(null);
            }
         });

         AllocationProbe probe = AllocationProbe.forThread(workerThread.get());
         try {
            while (true) {
               long wait = Math.min(MONITOR_INTERVAL_MILLIS, Math.max(1L, deadline.remainingMillis()));
               try {
                  return fut.get(wait, TimeUnit.MILLISECONDS);
               } catch (TimeoutException e) {
                  if (deadline.isExpired()) {
                     abort.set(Abort.TIMEOUT);
                  } else if (probe.allocatedSinceStart() > allocationLimitBytes) {
                     abort.set(Abort.MEMORY);
                  } else {
                     continue;
                  }
                  return cancel(fut, running, abort.get(), budgetMillis);
               }
            }
         } catch (ExecutionException e) {
            throw translate(e.getCause(), abort.get(), budgetMillis);
         } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel(fut, running, Abort.TIMEOUT, budgetMillis);
            throw new ScriptTimeoutException(budgetMillis);
         }
      }

      private AccessDecision cancel(Future<AccessDecision> fut, AtomicReference<Context> running, Abort reason,
                                    long budgetMillis) {
         ScriptAbortException abort = reason == Abort.MEMORY
                 ? new ScriptMemoryLimitException(allocationLimitBytes)
                 : new ScriptTimeoutException(budgetMillis);
         Context c = running.get();
         if (c != null) {
            try {
               c.close(true);
            } catch (PolyglotException | IllegalStateException e) {
               LOG.debugf(e, "Cancelling script context on slot %d", index);
            }
         }
         try {
            fut.get(CANCEL_GRACE_MILLIS, TimeUnit.MILLISECONDS);
         } catch (ExecutionException e) {
            // expected: the cancelled context fails the run
            LOG.tracef("Cancelled script on slot %d ended with %s", index, e.getCause());
         } catch (TimeoutException e) {
            fut.cancel(true);
            throw new SlotStuckException(abort);
         } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
         }
         throw abort;
      }

      private Context newContext() {
         return Context.newBuilder(LANGUAGE_ID)
                 .engine(engine)
                 .allowAllAccess(false)
                 .allowHostAccess(HostAccess.newBuilder()
                         .allowPublicAccess(false)
                         .allowAccessAnnotatedBy(HostAccess.Export.class)
                         .allowArrayAccess(true)
                         .allowListAccess(true)
                         .build())
                 .allowHostClassLookup(s -> false)
                 .allowIO(false)
                 .allowNativeAccess(false)
                 .allowCreateThread(false)
                 .allowCreateProcess(false)
                 .resourceLimits(limits)
                 .option("js.ecmascript-version", "2021")
                 .build();
      }

      void close() {
         worker.shutdownNow();
         try {
            engine.close(true);
         } catch (PolyglotException | IllegalStateException e) {
            LOG.debugf(e, "Closing JavaScript slot %d", index);
         }
      }
   }

   private ScriptAbortException translate(Throwable cause, Abort abort, long budgetMillis) {
      if (abort == Abort.MEMORY) {
         return new ScriptMemoryLimitException(allocationLimitBytes);
      }
      if (abort == Abort.TIMEOUT) {
         return new ScriptTimeoutException(budgetMillis);
      }
      if (cause instanceof ScriptAbortException sae) {
         return sae;
      }
      if (cause instanceof PolyglotException pe) {
         if (pe.isResourceExhausted()) {
            return new ScriptResourceExceededException("statements",
                    "Script exceeded the statement limit of " + statementLimit);
         }
         if (pe.isCancelled()) {
            return new ScriptTimeoutException(budgetMillis);
         }
         return new ScriptExecutionException(pe.getMessage());
      }
      if (cause instanceof StackOverflowError) {
         return new ScriptResourceExceededException("stack", "Script exhausted the worker stack");
      }
      return new ScriptExecutionException(String.valueOf(cause), cause);
   }

   static AccessDecision toDecision(Value value) {
      if (value == null || value.isNull()) {
         return ScriptResults.toDecision(null);
      }
      if (value.isBoolean()) {
         return ScriptResults.fromBoolean(value.asBoolean());
      }
      if (value.hasMembers() && value.hasMember(ScriptResults.DECISION)) {
         Value decision = value.getMember(ScriptResults.DECISION);
         if (decision.isString()) {
            Value reason = value.getMember(ScriptResults.REASON);
            return ScriptResults.fromDecision(decision.asString(),
                    reason != null && reason.isString() ? reason.asString() : null);
         }
      }
      return ScriptResults.toDecision(null);
   }

   /**
    * Bytes allocated by the worker thread since the probe was created, or zero when the
    * JVM cannot report per-thread allocation.
    */
   private static final class AllocationProbe {
      private final com.sun.management.ThreadMXBean bean;
      private final long threadId;
      private final long start;

      private AllocationProbe(com.sun.management.ThreadMXBean bean, long threadId) {
         this.bean = bean;
         this.threadId = threadId;
         this.start = bean == null ? 0L : Math.max(0L, bean.getThreadAllocatedBytes(threadId));
      }

      static AllocationProbe forThread(Thread thread) {
         ThreadMXBean bean = ManagementFactory.getThreadMXBean();
         if (thread != null && bean instanceof com.sun.management.ThreadMXBean sun
                 && sun.isThreadAllocatedMemorySupported() && sun.isThreadAllocatedMemoryEnabled()) {
            return new AllocationProbe(sun, thread.getId());
         }
         return new AllocationProbe(null, -1L);
      }

      long allocatedSinceStart() {
         if (bean == null) {
            return 0L;
         }
         long now = bean.getThreadAllocatedBytes(threadId);
         return now < 0 ? 0L : now - start;
      }
   }
}
