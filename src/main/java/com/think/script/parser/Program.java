package com.think.script.parser;

import java.util.ArrayList;
import java.util.List;

import com.think.script.parser.Statement.Stmt;

/**
 * Root of a parsed program: the objective, task declarations in declaration
 * order and run statements in execution order.
 */
public class Program {

    public final Objective objective;     // first objective, null only for hand-built programs
    public final List<Objective> objectives;
    public final List<Task> tasks;
    public final List<Run> runs;

    public Program(List<Objective> objectives, List<Task> tasks, List<Run> runs) {
        this.objectives = List.copyOf(objectives);
        this.objective = this.objectives.isEmpty() ? null : this.objectives.get(0);
        this.tasks = List.copyOf(tasks);
        this.runs = List.copyOf(runs);
    }

    /** First task declared under {@code name}, or null. */
    public Task findTask(String name) {
        for (Task t : tasks) {
            if (t.name.equals(name)) return t;
        }
        return null;
    }

    public List<Subtask> allSubtasks() {
        List<Subtask> out = new ArrayList<>();
        for (Task t : tasks) {
            for (Member m : t.members) {
                if (m instanceof Subtask) out.add((Subtask) m);
            }
        }
        return out;
    }

    public static final class Objective {
        public final Token keyword;
        public final String text;

        public Objective(Token keyword, String text) {
            this.keyword = keyword;
            this.text = text;
        }
    }

    public static final class Task {
        public final Token keyword;
        public final String name;
        public final List<Member> members;

        public Task(Token keyword, String name, List<Member> members) {
            this.keyword = keyword;
            this.name = name;
            this.members = List.copyOf(members);
        }
    }

    /** A step or subtask declared inside a task. */
    public interface Member {
        Token keyword();
        String name();
        List<Stmt> body();
    }

    public static final class Step implements Member {
        public final Token keyword;
        public final String name;
        public final List<Stmt> body;

        public Step(Token keyword, String name, List<Stmt> body) {
            this.keyword = keyword;
            this.name = name;
            this.body = List.copyOf(body);
        }

        public Token keyword() { return keyword; }
        public String name() { return name; }
        public List<Stmt> body() { return body; }
    }

    public static final class Subtask implements Member {
        public final Token keyword;
        public final String name;
        public final List<Stmt> body;

        public Subtask(Token keyword, String name, List<Stmt> body) {
            this.keyword = keyword;
            this.name = name;
            this.body = List.copyOf(body);
        }

        /** Key under which calls find this subtask, see {@link SubtaskRegistry#normalize(String)}. */
        public String normalizedName() {
            return SubtaskRegistry.normalize(name);
        }

        public Token keyword() { return keyword; }
        public String name() { return name; }
        public List<Stmt> body() { return body; }
    }

    public static final class Run {
        public final Token keyword;
        public final String taskName;

        public Run(Token keyword, String taskName) {
            this.keyword = keyword;
            this.taskName = taskName;
        }
    }
}
