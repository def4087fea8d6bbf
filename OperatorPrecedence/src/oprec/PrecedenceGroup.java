package oprec;

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.ForOverride;

// Binding strength is only defined relative to other groups, through higherThan and lowerThan.
@AutoValue
public abstract class PrecedenceGroup {

  // e.g. higherThan: AdditionPrecedence
  @AutoValue
  public abstract static class Relation {
    public abstract String groupName();

    public abstract Pos pos();

    public static Relation create(String groupName, Pos pos) {
      return new AutoValue_PrecedenceGroup_Relation(groupName, pos);
    }
  }

  private static final PrecedenceGroup DEFAULT = builder("DefaultPrecedence").build();

  // Operators without a group, or whose group is missing, fold in this one.
  public static PrecedenceGroup defaultGroup() {
    return DEFAULT;
  }

  public abstract String name();

  public abstract Associativity associativity();

  public abstract ImmutableList<Relation> higherThan();

  public abstract ImmutableList<Relation> lowerThan();

  public abstract Pos pos();

  // Identity, so that a declared group that happens to share the name stays distinct.
  public final boolean isDefault() {
    return this == DEFAULT;
  }

  public static Builder builder(String name) {
    return new AutoValue_PrecedenceGroup.Builder()
        .setName(name)
        .setAssociativity(Associativity.NONE)
        .setPos(Pos.internal());
  }

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setName(String name);

    public abstract Builder setAssociativity(Associativity associativity);

    public abstract Builder setPos(Pos pos);

    abstract ImmutableList.Builder<Relation> higherThanBuilder();

    abstract ImmutableList.Builder<Relation> lowerThanBuilder();

    @CanIgnoreReturnValue
    public Builder addHigherThan(String groupName, Pos pos) {
      higherThanBuilder().add(Relation.create(groupName, pos));
      return this;
    }

    @CanIgnoreReturnValue
    public Builder addHigherThan(String groupName) {
      return addHigherThan(groupName, Pos.internal());
    }

    @CanIgnoreReturnValue
    public Builder addLowerThan(String groupName, Pos pos) {
      lowerThanBuilder().add(Relation.create(groupName, pos));
      return this;
    }

    @CanIgnoreReturnValue
    public Builder addLowerThan(String groupName) {
      return addLowerThan(groupName, Pos.internal());
    }

    @ForOverride
    abstract PrecedenceGroup autoBuild();

    public final PrecedenceGroup build() {
      PrecedenceGroup group = autoBuild();
      Preconditions.checkArgument(!group.name().isEmpty(), "precedence group name is empty");
      return group;
    }
  }
}
