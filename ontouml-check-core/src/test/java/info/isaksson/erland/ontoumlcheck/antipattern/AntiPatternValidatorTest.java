package info.isaksson.erland.ontoumlcheck.antipattern;

import info.isaksson.erland.ontoumlcheck.TestModels;
import info.isaksson.erland.ontoumlcheck.graph.ModelIndex;
import info.isaksson.erland.ontoumlcheck.model.OntoModel;
import info.isaksson.erland.ontoumlcheck.validation.AntiPatternOccurrence;
import info.isaksson.erland.ontoumlcheck.validation.AntiPatternType;
import info.isaksson.erland.ontoumlcheck.validation.ProblemCollector;
import info.isaksson.erland.ontoumlcheck.validation.ValidationProblem;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;

import static info.isaksson.erland.ontoumlcheck.validation.AntiPatternType.*;
import static org.junit.jupiter.api.Assertions.*;

public class AntiPatternValidatorTest {

    private static List<AntiPatternOccurrence> run(OntoModel model, EnumSet<AntiPatternType> enabled) {
        ProblemCollector out = new ProblemCollector();
        new AntiPatternValidator().validate(ModelIndex.build(model), enabled, out);
        List<AntiPatternOccurrence> found = new ArrayList<>();
        for (ValidationProblem p : out.toList()) {
            found.add((AntiPatternOccurrence) p);
        }
        return found;
    }

    /** Ids flagged by all detectors for the given type. */
    private static List<String> flagged(OntoModel model, AntiPatternType type) {
        List<String> ids = new ArrayList<>();
        for (AntiPatternOccurrence o : run(model, EnumSet.allOf(AntiPatternType.class))) {
            if (o.type == type) ids.add(o.elementId);
        }
        return ids;
    }

    @Test
    void selfLoopIsBinOver() {
        OntoModel model = TestModels.model()
                .cls("Car", "kind")
                .assoc("a1", "componentOf", "Car", "1", "Car", "1")
                .build();

        assertEquals(List.of("a1"), flagged(model, BIN_OVER));
    }

    @Test
    void binOverOnSubtypeAndOverlappingEnds() {
        OntoModel model = TestModels.model()
                .cls("Person", "kind")
                .cls("Man", "subkind")
                .cls("Woman", "subkind")
                .cls("Student", "role")
                .cls("Car", "kind")
                .genSet("gSex", List.of("Man", "Woman"), List.of("Person"), true, true)
                .gen("gStudent", "Student", "Person")
                .assoc("a1", "", "Person", "", "Man", "")
                .assoc("a2", "", "Man", "", "Woman", "")
                .assoc("a3", "", "Man", "", "Student", "")
                .assoc("a4", "", "Person", "", "Car", "")
                .build();

        assertEquals(List.of("a1", "a3"), flagged(model, BIN_OVER));
    }

    @Test
    void binOverOnMixinsSharingASubtype() {
        OntoModel model = TestModels.model()
                .abstractCls("Insurable", "mixin")
                .abstractCls("Rentable", "mixin")
                .abstractCls("Tradable", "category")
                .cls("Car", "kind")
                .gen("g1", "Car", "Insurable")
                .gen("g2", "Car", "Rentable")
                .assoc("a1", "", "Insurable", "", "Rentable", "")
                .assoc("a2", "", "Insurable", "", "Tradable", "")
                .assoc("a3", "", "Car", "", "Tradable", "")
                .build();

        assertEquals(List.of("a1"), flagged(model, BIN_OVER));
    }

    @Test
    void decIntCountsClassificationAxes() {
        OntoModel model = TestModels.model()
                .cls("Person", "kind")
                .cls("Robot", "kind")
                .abstractCls("Agent", "category")
                .cls("Cyborg", "subkind")
                .cls("Man", "subkind")
                .cls("Clerk", "role")
                .gen("g1", "Cyborg", "Person")
                .gen("g2", "Cyborg", "Robot")
                .genSet("g3", List.of("Man"), List.of("Person"), true, true)
                .gen("g4", "Clerk", "Person")
                .gen("g5", "Clerk", "Agent")
                .build();

        assertEquals(List.of("Cyborg"), flagged(model, DEC_INT));
    }

    @Test
    void phaseInMediationIsDepPhase() {
        OntoModel model = TestModels.model()
                .cls("Person", "kind")
                .cls("Adult", "phase")
                .cls("Child", "phase")
                .cls("Employment", "relator")
                .genSet("g1", List.of("Child", "Adult"), List.of("Person"), true, true)
                .assoc("m1", "mediation", "Employment", "1..*", "Adult", "1")
                .build();

        assertEquals(List.of("Adult"), flagged(model, DEP_PHASE));
    }

    @Test
    void unmediatedRoleIsFreeRole() {
        OntoModel model = TestModels.model()
                .cls("Person", "kind")
                .cls("Student", "role")
                .cls("Customer", "role")
                .cls("Enrollment", "relator")
                .gen("g1", "Student", "Person")
                .gen("g2", "Customer", "Person")
                .assoc("m1", "mediation", "Enrollment", "1", "Student", "1")
                .build();

        assertEquals(List.of("Customer"), flagged(model, FREE_ROLE));
    }

    @Test
    void generalizationSetMixingRigidity() {
        OntoModel model = TestModels.model()
                .cls("Person", "kind")
                .cls("Man", "subkind")
                .cls("Student", "role")
                .cls("Child", "phase")
                .cls("Adult", "phase")
                .genSet("mixed", List.of("Man", "Student"), List.of("Person"), false, false)
                .genSet("phases", List.of("Child", "Adult"), List.of("Person"), true, true)
                .build();

        assertEquals(List.of("mixed"), flagged(model, GS_RIG));
    }

    @Test
    void collectiveOfTwoMemberTypesIsHetColl() {
        OntoModel model = TestModels.model()
                .cls("Crew", "collective")
                .cls("Pilot", "kind")
                .cls("Steward", "kind")
                .assoc("a1", "memberOf", "Crew", "1", "Pilot", "1..*")
                .assoc("a2", "memberOf", "Crew", "1", "Steward", "1..*")
                .build();

        assertEquals(List.of("Crew"), flagged(model, HET_COLL));
    }

    @Test
    void collectiveOfOneMemberTypeIsFine() {
        OntoModel model = TestModels.model()
                .cls("Crew", "collective")
                .cls("Pilot", "kind")
                .assoc("a1", "memberOf", "Crew", "1", "Pilot", "1..*")
                .build();

        assertEquals(List.of(), flagged(model, HET_COLL));
    }

    @Test
    void singleComponentIsHomoFunc() {
        OntoModel model = TestModels.model()
                .cls("Car", "kind")
                .cls("Engine", "kind")
                .cls("Wheel", "kind")
                .cls("Bike", "kind")
                .assoc("a1", "componentOf", "Car", "1", "Engine", "1")
                .assoc("a2", "componentOf", "Bike", "1", "Wheel", "2")
                .assoc("a3", "componentOf", "Bike", "1", "Engine", "0..1")
                .build();

        assertEquals(List.of("Car"), flagged(model, HOMO_FUNC));
    }

    @Test
    void mixinWithOneSidedChildrenIsMixRig() {
        OntoModel model = TestModels.model()
                .abstractCls("Insurable", "mixin")
                .abstractCls("Seated", "mixin")
                .abstractCls("Unused", "mixin")
                .cls("Car", "kind")
                .cls("Person", "kind")
                .cls("Passenger", "role")
                .gen("g1", "Car", "Insurable")
                .gen("g2", "Person", "Insurable")
                .gen("g3", "Car", "Seated")
                .gen("g4", "Passenger", "Person")
                .gen("g5", "Passenger", "Seated")
                .build();

        assertEquals(List.of("Insurable"), flagged(model, MIX_RIG));
    }

    @Test
    void dependingOnTwoRelatorsIsMultDep() {
        OntoModel model = TestModels.model()
                .cls("Person", "kind")
                .cls("Spouse", "role")
                .cls("Marriage", "relator")
                .abstractCls("Contract", "relator")
                .cls("Employment", "subkind")
                .gen("g1", "Spouse", "Person")
                .gen("g2", "Employment", "Contract")
                .assoc("m1", "mediation", "Marriage", "1", "Spouse", "2")
                .assoc("m2", "mediation", "Employment", "1", "Spouse", "1")
                .build();

        assertEquals(List.of("Spouse"), flagged(model, MULT_DEP));
    }

    @Test
    void relatorMediatingRigidTypeIsRelRig() {
        OntoModel model = TestModels.model()
                .cls("Person", "kind")
                .cls("Spouse", "role")
                .cls("Marriage", "relator")
                .cls("Employment", "relator")
                .gen("g1", "Spouse", "Person")
                .assoc("m1", "mediation", "Marriage", "1", "Spouse", "2")
                .assoc("m2", "mediation", "Employment", "1", "Person", "1")
                .assoc("m3", "mediation", "Employment", "1", "Spouse", "1")
                .build();

        assertEquals(List.of("Employment"), flagged(model, REL_RIG));
    }

    @Test
    void formalAssociationWithoutPropertiesIsUndefFormal() {
        OntoModel model = TestModels.model()
                .cls("Person", "kind", false, "height: int")
                .cls("Man", "subkind")
                .cls("Building", "kind")
                .cls("Weight", "quality")
                .cls("Car", "kind")
                .gen("g1", "Man", "Person")
                .assoc("c1", "characterization", "Building", "1", "Weight", "1")
                .assoc("f1", "formal", "Man", "", "Building", "")
                .assoc("f2", "formal", "Person", "", "Car", "")
                .build();

        assertEquals(List.of("f2"), flagged(model, UNDEF_FORMAL));
    }

    @Test
    void phaseOfPropertylessKindIsUndefPhase() {
        OntoModel model = TestModels.model()
                .cls("Person", "kind", false, "age: int")
                .cls("Child", "phase")
                .cls("Tree", "kind")
                .cls("Sapling", "phase")
                .genSet("g1", List.of("Child"), List.of("Person"), true, true)
                .genSet("g2", List.of("Sapling"), List.of("Tree"), true, true)
                .build();

        assertEquals(List.of("Sapling"), flagged(model, UNDEF_PHASE));
    }

    @Test
    void disabledDetectorsDoNotRun() {
        OntoModel model = TestModels.model()
                .cls("Car", "kind")
                .assoc("a1", "componentOf", "Car", "1", "Car", "1")
                .build();

        List<AntiPatternOccurrence> all = run(model, EnumSet.allOf(AntiPatternType.class));
        assertEquals(2, all.size());
        assertEquals(BIN_OVER, all.get(0).type);
        assertEquals(HOMO_FUNC, all.get(1).type);

        List<AntiPatternOccurrence> some = run(model, EnumSet.of(HOMO_FUNC));
        assertEquals(1, some.size());
        assertEquals("Car", some.get(0).elementId);

        assertEquals(List.of(), run(model, EnumSet.noneOf(AntiPatternType.class)));
        assertEquals(List.of(), run(model, null));
    }

    @Test
    void detectorsCoverEveryType() {
        EnumSet<AntiPatternType> covered = EnumSet.noneOf(AntiPatternType.class);
        for (AntiPatternDetector d : AntiPatternValidator.defaultDetectors()) {
            assertTrue(covered.add(d.type()), "duplicate detector for " + d.type());
        }
        assertEquals(EnumSet.allOf(AntiPatternType.class), covered);
    }

    @Test
    void cyclicHierarchyTerminates() {
        OntoModel model = TestModels.model()
                .cls("A", "phase")
                .cls("B", "phase")
                .abstractCls("M", "mixin")
                .gen("g1", "A", "B")
                .gen("g2", "B", "A")
                .gen("g3", "A", "M")
                .assoc("f1", "formal", "A", "", "B", "")
                .build();

        List<String> undefPhase = flagged(model, UNDEF_PHASE);
        assertEquals(List.of("A", "B"), undefPhase);
        assertEquals(List.of("f1"), flagged(model, BIN_OVER));
    }
}
