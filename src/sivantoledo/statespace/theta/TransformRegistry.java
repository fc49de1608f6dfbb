package sivantoledo.statespace.theta;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.math3.exception.OutOfRangeException;

/**
 * An immutable, indexed list of transforms. Indexes are one based; zero is 
 * reserved for fixed entries in transformation indexes.
 * 
 * @author Sivan Toledo
 */
public final class TransformRegistry {
  
  private final List<Transform> transforms;
  
  public TransformRegistry(List<Transform> transforms) {
    this.transforms = Collections.unmodifiableList(new ArrayList<>(transforms));
  }
  
  /**
   * @return a registry whose only transform is the identity, at index 1
   */
  public static TransformRegistry identity() {
    return new TransformRegistry(Collections.singletonList(Transform.IDENTITY));
  }
  
  public int size() { return transforms.size(); }
  
  /**
   * @param i one-based index
   */
  public Transform get(int i) {
    if (i < 1 || i > transforms.size()) throw new OutOfRangeException(i, 1, transforms.size());
    return transforms.get(i-1);
  }
  
  public List<Transform> transforms() { return transforms; }
  
  /**
   * @return the one-based index of the first transform equal to t, or 0 if there is none
   */
  public int indexOf(Transform t) {
    return transforms.indexOf(t) + 1;
  }
  
  /**
   * Registers a transform, reusing an equal one when present.
   * 
   * @return a registry that contains t; it is this registry when t was already present
   */
  public TransformRegistry with(Transform t) {
    if (indexOf(t) > 0) return this;
    List<Transform> extended = new ArrayList<>(transforms);
    extended.add(t);
    return new TransformRegistry(extended);
  }
  
  /**
   * Removes the transforms that are not used and merges equal transforms onto
   * the lowest surviving index.
   * 
   * @param used used[i-1] tells whether transform i is referenced
   * @param relabel filled with the new index of every old transform (0 if removed);
   *   its length must be size()+1, relabel[0] stays 0
   * @return the compressed registry
   */
  public TransformRegistry compress(boolean[] used, int[] relabel) {
    if (used.length != transforms.size() || relabel.length != transforms.size()+1) 
      throw new IllegalArgumentException("relabeling arrays do not match the registry");
    
    List<Transform>         kept  = new ArrayList<>();
    Map<Transform, Integer> first = new HashMap<>();
    relabel[0] = 0;
    for (int i=1; i<=transforms.size(); i++) {
      if (!used[i-1]) { relabel[i] = 0; continue; }
      Transform t = transforms.get(i-1);
      Integer existing = first.get(t);
      if (existing == null) {
        kept.add(t);
        existing = kept.size();
        first.put(t, existing);
      }
      relabel[i] = existing;
    }
    return new TransformRegistry(kept);
  }
  
  @Override
  public boolean equals(Object o) {
    return o instanceof TransformRegistry && transforms.equals(((TransformRegistry) o).transforms);
  }
  
  @Override
  public int hashCode() { return transforms.hashCode(); }
  
  @Override
  public String toString() { return transforms.toString(); }
}
