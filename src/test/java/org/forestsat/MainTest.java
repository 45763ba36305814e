package org.forestsat;

import org.forestsat.cnf.DimacsReader;
import org.forestsat.cnf.DimacsInstance;
import org.forestsat.cnf.SolverModel;
import org.forestsat.support.SatOracle;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.stream.Collectors;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.startsWith;

public class MainTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private File problemFile(String text) throws IOException {
        File file = folder.newFile("problem.forest");
        Files.writeString(file.toPath(), text, StandardCharsets.UTF_8);
        return file;
    }

    @Test
    public void compilesToDimacsAndMap() throws IOException {
        File problem = problemFile("node a b c\nedge a b\nedge b c\nroot 0 a\n");
        Path out = folder.getRoot().toPath().resolve("out/forest.cnf");

        int status = Main.run(new String[]{"-f", problem.getPath(), "-o", out.toString(), "-enc=binary", "-stats"});
        assertThat(status, is(0));

        String dimacs = Files.readString(out, StandardCharsets.UTF_8);
        assertThat(dimacs, startsWith("p cnf "));
        DimacsInstance instance = DimacsReader.parse(dimacs);

        String map = Files.readString(out.resolveSibling("forest.map"), StandardCharsets.UTF_8);
        assertThat(map, containsString(" col(a)=0\n"));
        assertThat(map, containsString(" dist(c)_b1\n"));
        assertThat(map.lines().count(), is((long) instance.numVars()));
    }

    @Test
    public void decodesSolverModel() throws IOException {
        File problem = problemFile("node a b\nedge a b\nroot 0 a\n");
        Path cnfPath = folder.getRoot().toPath().resolve("pair.cnf");
        assertThat(Main.run(new String[]{"-f", problem.getPath(), "-o", cnfPath.toString()}), is(0));

        DimacsInstance instance = DimacsReader.parse(Files.readString(cnfPath, StandardCharsets.UTF_8));
        SolverModel model = SatOracle.solve(instance.numVars(), instance.clauses());
        String literals = model.trueVariables().stream().map(String::valueOf).collect(Collectors.joining(" "));
        File modelFile = folder.newFile("pair.model");
        Files.writeString(modelFile.toPath(), "s SATISFIABLE\nv " + literals + " 0\n", StandardCharsets.UTF_8);

        assertThat(Main.run(new String[]{"-f", problem.getPath(), "-m", modelFile.getPath()}), is(0));
    }

    @Test
    public void unsatModelIsReported() throws IOException {
        File problem = problemFile("node a b\nroot 0 a\n");
        File modelFile = folder.newFile("unsat.model");
        Files.writeString(modelFile.toPath(), "s UNSATISFIABLE\n", StandardCharsets.UTF_8);
        assertThat(Main.run(new String[]{"-f", problem.getPath(), "-m", modelFile.getPath()}), is(0));
    }

    @Test
    public void invalidProblemExitsWithError() throws IOException {
        File problem = problemFile("node a\nedge a a\nroot 0 a\n");
        assertThat(Main.run(new String[]{"-f", problem.getPath()}), is(1));
    }

    @Test
    public void syntaxErrorExitsWithError() throws IOException {
        File problem = problemFile("node a\nroot x a\n");
        assertThat(Main.run(new String[]{"-f", problem.getPath()}), is(1));
    }

    @Test
    public void badArguments() throws IOException {
        assertThat(Main.run(new String[]{}), is(1));
        assertThat(Main.run(new String[]{"-x"}), is(1));
        assertThat(Main.run(new String[]{"-f"}), is(1));
        assertThat(Main.run(new String[]{"-f", "does-not-exist.forest"}), is(1));
        File problem = problemFile("node a\nroot 0 a\n");
        assertThat(Main.run(new String[]{"-f", problem.getPath(), "-enc=ternary"}), is(1));
    }

    @Test
    public void helpExitsCleanly() {
        assertThat(Main.run(new String[]{"-h"}), is(0));
    }

    @Test
    public void mapFileSitsBesideCnf() {
        assertThat(Main.mapPathFor(Paths.get("dir", "x.cnf")), is(Paths.get("dir", "x.map")));
        assertThat(Main.mapPathFor(Paths.get("dir", "x.dimacs")), is(Paths.get("dir", "x.dimacs.map")));
    }
}
