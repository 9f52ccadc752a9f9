package com.booking.banana;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Receives {@code ("dict",)} as a {@link LinkedHashMap} from alternating keys and values.
 * <p>
 * Keys must be complete objects other than lists, dicts or sets. Values may be pending references:
 * they are {@code null} until they resolve, and hold the {@link UnbananaFailure} if they fail.
 */
public class DictUnslicer extends BaseUnslicer {
  public static final String OPENTYPE = "dict";

  private final Map<Object, Object> map = new LinkedHashMap<>();
  private Constraint keyConstraint;
  private Constraint valueConstraint;
  private int maxKeys;
  private boolean haveKey;
  private Object key;

  @Override
  public void setConstraint(Constraint constraint) throws Violation {
    super.setConstraint(constraint);
    if (constraint instanceof DictConstraint) {
      DictConstraint dictConstraint = (DictConstraint) constraint;
      keyConstraint = dictConstraint.key();
      valueConstraint = dictConstraint.value();
      maxKeys = dictConstraint.maxKeys();
    }
  }

  @Override
  public void start(int openId) throws Violation, BananaError {
    super.start(openId);
    setObject(openId, map);
  }

  @Override
  protected Constraint childConstraint() {
    Constraint child = haveKey ? valueConstraint : keyConstraint;
    return child instanceof AnyConstraint ? null : child;
  }

  @Override
  public void checkToken(BananaToken type, long size) throws Violation, BananaError {
    if (!haveKey && maxKeys > 0 && map.size() >= maxKeys) {
      throw new Violation("Dict is limited to " + maxKeys + " keys");
    }
    super.checkToken(type, size);
  }

  @Override
  public void receiveChild(Object child) throws Violation {
    propagateFailure(child);
    if (!haveKey) {
      if (child instanceof Placeholder) {
        throw new Violation("Dict keys can't be references to unfinished structures");
      }
      checkHashable(child, "Dict keys");
      if (map.containsKey(child)) {
        throw new Violation("Duplicate key " + child);
      }
      key = child;
      haveKey = true;
      return;
    }

    Object valueKey = key;
    haveKey = false;
    key = null;
    if (child instanceof Placeholder) {
      map.put(valueKey, null);
      fillWhenResolved((Placeholder) child, value -> map.put(valueKey, value));
    } else {
      map.put(valueKey, child);
    }
  }

  @Override
  public Object receiveClose() throws Violation {
    if (haveKey) {
      throw new Violation("Dict closed after key " + key + " without a value");
    }
    return map;
  }

  @Override
  public String describe() {
    return haveKey ? "{" + key + "}" : "{}";
  }
}
