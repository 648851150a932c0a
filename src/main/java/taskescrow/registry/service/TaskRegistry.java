package taskescrow.registry.service;

import taskescrow.registry.core.TaskEventBus;
import taskescrow.registry.error.RegistryException;
import taskescrow.registry.funds.FundsTransfer;
import taskescrow.registry.funds.TransferFailedException;
import taskescrow.registry.model.CompletionResult;
import taskescrow.registry.model.Payment;
import taskescrow.registry.model.PlatformState;
import taskescrow.registry.model.Task;
import taskescrow.registry.model.TaskEvent;
import taskescrow.registry.model.TaskStatus;
import taskescrow.registry.repository.ParticipantRepository;
import taskescrow.registry.repository.PlatformRepository;
import taskescrow.registry.repository.TaskRepository;
import taskescrow.registry.store.Database;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Escrowed task lifecycle: creation, acceptance, dual-confirmation payout, cancellation,
 * fee policy and the owner's emergency sweep.
 *
 * <p>Every mutating call holds the registry lock and runs in one database transaction.
 * Transfers happen before commit, so a failed transfer rolls back the whole call.
 * Events are published after commit, in emission order, while the lock is still held.
 */
public class TaskRegistry {

    private static final Logger log = LoggerFactory.getLogger(TaskRegistry.class);

    private final Database database;
    private final TaskRepository taskRepository;
    private final ParticipantRepository participantRepository;
    private final PlatformRepository platformRepository;
    private final FundsTransfer funds;
    private final TaskEventBus eventBus;
    private final Clock clock;

    private final ReentrantLock writeLock = new ReentrantLock(true);

    public TaskRegistry(Database database,
            TaskRepository taskRepository,
            ParticipantRepository participantRepository,
            PlatformRepository platformRepository,
            FundsTransfer funds,
            TaskEventBus eventBus,
            Clock clock) {
        this.database = database;
        this.taskRepository = taskRepository;
        this.participantRepository = participantRepository;
        this.platformRepository = platformRepository;
        this.funds = funds;
        this.eventBus = eventBus;
        this.clock = clock;
    }

    /**
     * Create and fund a task. The escrowed amount arrives with the call and is held
     * by the registry until payout or refund.
     *
     * @param title          non-empty title
     * @param description    free text, may be null
     * @param deadline       acceptance deadline, strictly in the future
     * @param escrowedAmount reward, strictly positive
     * @param caller         client identity
     * @return the new task id
     */
    public long createTask(String title, String description, Instant deadline, long escrowedAmount, String caller) {
        requireCaller(caller);
        if (escrowedAmount <= 0) {
            throw RegistryException.invalidInput("reward must be greater than zero");
        }
        if (deadline == null || !deadline.isAfter(clock.instant())) {
            throw RegistryException.invalidInput("deadline must be in the future");
        }
        if (title == null || title.isEmpty()) {
            throw RegistryException.invalidInput("title must not be empty");
        }
        if (title.length() > Task.MAX_TITLE_LENGTH) {
            throw RegistryException.invalidInput("title exceeds " + Task.MAX_TITLE_LENGTH + " characters");
        }

        return mutate(op -> database.inTransaction(conn -> {
            PlatformState state = platformRepository.loadForUpdate(conn);
            long taskId = state.taskCounter() + 1;
            long held;
            try {
                held = Math.addExact(state.heldBalance(), escrowedAmount);
            } catch (ArithmeticException e) {
                throw RegistryException.invalidInput("reward overflows the registry balance");
            }

            Task task = Task.builder()
                    .id(taskId)
                    .title(title)
                    .description(description)
                    .reward(escrowedAmount)
                    .client(caller)
                    .status(TaskStatus.OPEN)
                    .deadline(deadline)
                    .build();

            taskRepository.insert(conn, task);
            participantRepository.appendTask(conn, caller, taskId);
            platformRepository.save(conn, state.withTaskCounter(taskId).withHeldBalance(held));

            op.emit(new TaskEvent.TaskCreated(taskId, caller, title, escrowedAmount));
            log.info("Task {} created by {} with reward {}", taskId, caller, escrowedAmount);
            return taskId;
        }));
    }

    /**
     * Claim an open task as its freelancer. Allowed strictly before the deadline,
     * never for the task's own client.
     */
    public Task acceptTask(long taskId, String caller) {
        requireCaller(caller);

        return mutate(op -> database.inTransaction(conn -> {
            Task task = taskRepository.findForUpdate(conn, taskId)
                    .orElseThrow(() -> RegistryException.notFound(taskId));

            if (task.status() != TaskStatus.OPEN) {
                throw RegistryException.invalidState("task " + taskId + " is " + task.status() + ", not OPEN");
            }
            if (task.isClient(caller)) {
                throw RegistryException.unauthorized("client cannot accept their own task");
            }
            if (!task.acceptsBefore(clock.instant())) {
                throw RegistryException.invalidState("deadline of task " + taskId + " has passed");
            }

            Task assigned = task.toBuilder()
                    .freelancer(caller)
                    .status(TaskStatus.ASSIGNED)
                    .build();

            taskRepository.update(conn, assigned);
            participantRepository.appendTask(conn, caller, taskId);

            op.emit(new TaskEvent.TaskAssigned(taskId, caller));
            log.info("Task {} assigned to {}", taskId, caller);
            return assigned;
        }));
    }

    /**
     * Record a confirmation. The freelancer submits, the client approves after submission.
     * The call that sets the second flag completes the task and releases the payment:
     * {@code reward - fee} to the freelancer and {@code fee} to the owner, with the fee
     * computed from the percentage in effect at payout time.
     *
     * @return {@link CompletionResult#SUBMITTED} or {@link CompletionResult#COMPLETED}
     */
    public CompletionResult completeTask(long taskId, String caller) {
        requireCaller(caller);

        return mutate(op -> database.inTransaction(conn -> {
            Task task = taskRepository.findForUpdate(conn, taskId)
                    .orElseThrow(() -> RegistryException.notFound(taskId));

            Task confirmed;
            if (task.isFreelancer(caller)) {
                if (task.status() != TaskStatus.ASSIGNED) {
                    throw RegistryException.invalidState("task " + taskId + " is " + task.status() + ", not ASSIGNED");
                }
                confirmed = task.toBuilder().freelancerSubmitted(true).build();
            } else if (task.isClient(caller)) {
                if (!task.freelancerSubmitted()) {
                    throw RegistryException.invalidState("freelancer has not submitted task " + taskId);
                }
                if (task.status() != TaskStatus.ASSIGNED) {
                    throw RegistryException.invalidState("task " + taskId + " is " + task.status() + ", not ASSIGNED");
                }
                confirmed = task.toBuilder().clientApproved(true).build();
            } else {
                throw RegistryException.unauthorized("only the client or freelancer can complete task " + taskId);
            }

            boolean completesPair = !task.isConfirmedByBoth() && confirmed.isConfirmedByBoth();
            if (!completesPair) {
                taskRepository.update(conn, confirmed);
                log.info("Task {} submitted by {}", taskId, caller);
                return CompletionResult.SUBMITTED;
            }

            String freelancer = confirmed.freelancer().orElseThrow();
            PlatformState state = platformRepository.loadForUpdate(conn);
            long fee = state.feeFor(task.reward());
            long payout = task.reward() - fee;

            Task completed = confirmed.toBuilder().status(TaskStatus.COMPLETED).build();
            taskRepository.update(conn, completed);
            participantRepository.incrementCompleted(conn, freelancer);
            participantRepository.incrementCompleted(conn, task.client());
            platformRepository.save(conn, state.withHeldBalance(releaseFromCustody(state, task.reward())));

            List<Payment> payments = new ArrayList<>();
            payments.add(new Payment(freelancer, payout));
            if (fee > 0) {
                payments.add(new Payment(state.owner(), fee));
            }
            pay(op, payments, "payout of task " + taskId);

            op.emit(new TaskEvent.TaskCompleted(taskId, freelancer, task.client()));
            op.emit(new TaskEvent.PaymentReleased(taskId, freelancer, payout));
            log.info("Task {} completed: paid {} to {}, fee {} at {}%",
                    taskId, payout, freelancer, fee, state.platformFeePercentage());
            return CompletionResult.COMPLETED;
        }));
    }

    /**
     * Cancel an open task and refund the full reward to its client. No fee is taken.
     */
    public Task cancelTask(long taskId, String caller) {
        requireCaller(caller);

        return mutate(op -> database.inTransaction(conn -> {
            Task task = taskRepository.findForUpdate(conn, taskId)
                    .orElseThrow(() -> RegistryException.notFound(taskId));

            if (!task.isClient(caller)) {
                throw RegistryException.unauthorized("only the client can cancel task " + taskId);
            }
            if (task.status() != TaskStatus.OPEN) {
                throw RegistryException.invalidState("task " + taskId + " is " + task.status() + ", not OPEN");
            }

            PlatformState state = platformRepository.loadForUpdate(conn);
            Task cancelled = task.toBuilder().status(TaskStatus.CANCELLED).build();
            taskRepository.update(conn, cancelled);
            platformRepository.save(conn, state.withHeldBalance(releaseFromCustody(state, task.reward())));
            pay(op, List.of(new Payment(task.client(), task.reward())), "refund of task " + taskId);

            op.emit(new TaskEvent.TaskCancelled(taskId, task.client()));
            log.info("Task {} cancelled, refunded {} to {}", taskId, task.reward(), task.client());
            return cancelled;
        }));
    }

    /**
     * Change the platform fee. Applies to every payout from now on, including tasks
     * escrowed under the previous percentage.
     */
    public PlatformState updatePlatformFee(int newFeePercentage, String caller) {
        requireCaller(caller);

        return mutate(op -> database.inTransaction(conn -> {
            PlatformState state = platformRepository.loadForUpdate(conn);
            if (!state.isOwner(caller)) {
                log.warn("Rejected fee update by non-owner {}", caller);
                throw RegistryException.unauthorized("only the owner can update the platform fee");
            }
            if (newFeePercentage < 0 || newFeePercentage > PlatformState.MAX_FEE_PERCENTAGE) {
                throw RegistryException.invalidInput("fee must be between 0 and "
                        + PlatformState.MAX_FEE_PERCENTAGE + ", got " + newFeePercentage);
            }

            PlatformState updated = state.withFeePercentage(newFeePercentage);
            platformRepository.save(conn, updated);
            log.info("Platform fee changed from {}% to {}%", state.platformFeePercentage(), newFeePercentage);
            return updated;
        }));
    }

    /**
     * Sweep the entire balance in custody to the owner, regardless of which tasks it
     * was escrowed for. Payouts and refunds that can no longer be covered will fail
     * with a transfer failure afterwards.
     *
     * @return amount withdrawn
     */
    public long emergencyWithdraw(String caller) {
        requireCaller(caller);

        return mutate(op -> database.inTransaction(conn -> {
            PlatformState state = platformRepository.loadForUpdate(conn);
            if (!state.isOwner(caller)) {
                log.warn("Rejected emergency withdrawal by non-owner {}", caller);
                throw RegistryException.unauthorized("only the owner can withdraw");
            }

            long amount = state.heldBalance();
            platformRepository.save(conn, state.withHeldBalance(0L));
            if (amount > 0) {
                pay(op, List.of(new Payment(state.owner(), amount)), "emergency withdrawal");
            }

            log.warn("Emergency withdrawal of {} to owner {}", amount, state.owner());
            return amount;
        }));
    }

    // ---------- Reads ----------

    public Task getTask(long taskId) {
        return taskRepository.findById(taskId)
                .orElseThrow(() -> RegistryException.notFound(taskId));
    }

    public List<Long> getUserTasks(String identity) {
        return participantRepository.findTaskIds(identity);
    }

    public long getTotalTasks() {
        return platformRepository.load().taskCounter();
    }

    public long getCompletedTaskCount(String identity) {
        return participantRepository.completedCount(identity);
    }

    public PlatformState getPlatformState() {
        return platformRepository.load();
    }

    public int countByStatus(TaskStatus status) {
        return taskRepository.countByStatus(status);
    }

    // ---------- Internals ----------

    private <T> T mutate(Function<Operation, T> work) {
        writeLock.lock();
        try {
            Operation op = new Operation();
            T result;
            try {
                result = work.apply(op);
            } catch (RuntimeException e) {
                if (!op.settled.isEmpty()) {
                    // Funds left custody but the state change did not commit
                    log.error("Registry state NOT committed after paying {}; reconcile manually",
                            op.settled, e);
                }
                throw e;
            }
            eventBus.publish(op.events);
            return result;
        } finally {
            writeLock.unlock();
        }
    }

    private void pay(Operation op, List<Payment> payments, String purpose) {
        try {
            funds.transfer(payments);
        } catch (TransferFailedException e) {
            log.warn("Transfer for {} failed, rolling back: {}", purpose, e.getMessage());
            throw RegistryException.transferFailed(e.getMessage(), e);
        }
        op.settled.addAll(payments);
    }

    private static long releaseFromCustody(PlatformState state, long amount) {
        if (state.heldBalance() < amount) {
            throw RegistryException.transferFailed("registry holds " + state.heldBalance()
                    + ", cannot release " + amount, null);
        }
        return state.heldBalance() - amount;
    }

    private static void requireCaller(String caller) {
        if (caller == null || caller.isBlank()) {
            throw RegistryException.unauthorized("caller identity is required");
        }
        if (caller.length() > Task.MAX_IDENTITY_LENGTH) {
            throw RegistryException.invalidInput("caller identity exceeds " + Task.MAX_IDENTITY_LENGTH + " characters");
        }
    }

    /**
     * Events emitted and payments settled by one mutating call.
     */
    private static final class Operation {
        private final List<TaskEvent> events = new ArrayList<>();
        private final List<Payment> settled = new ArrayList<>();

        void emit(TaskEvent event) {
            events.add(event);
        }
    }
}
