/* 
 * Copyright (C) 2026 the SMEARGLE developers
 *
 * This File is part of SMEARGLE
 *
 * SMEARGLE is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * SMEARGLE is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with SMEARGLE.  If not, see <http://www.gnu.org/licenses/>.
 */
package smeargle.utils;

import java.util.*;
import java.util.function.BiPredicate;
import java.util.stream.Collectors;

/**
 * Failures collected during a batch run. Each failure is localized: key is the source of the exception (image and plugin name).
 * @author SMEARGLE developers
 */
public class MultipleException extends RuntimeException {
    final private List<Pair<String, Throwable>> exceptions;
    public MultipleException(List<Pair<String, Throwable>> exceptions) {
        this.exceptions= new ArrayList<>();
        addExceptions(exceptions);
    }
    public MultipleException() {
        this.exceptions=new ArrayList<>();
    }
    public void addExceptions(Collection<Pair<String, Throwable>> ex) {
        ex.forEach(this::addException);
    }

    public void addException(String source, Throwable t) {
        addException(new Pair<>(source, t));
    }

    private void addException(Pair<String, Throwable> ex) {
        if (ex==null || ex.value==null || ex.key==null) return;
        if (ex.value instanceof MultipleException) { // unroll
            ((MultipleException)ex.value).getExceptions().forEach(p -> addException(new Pair<>(ex.key+"/"+p.key, p.value)));
            return;
        }
        Optional<Pair<String, Throwable>> same = exceptions.stream().filter(p->thowableEqual.test(p.value, ex.value)).findAny();
        if (same.isPresent()) same.get().key+=";"+ex.key;
        else exceptions.add(ex);
    }

    private final static BiPredicate<Throwable, Throwable> tEq = (t1, t2) -> {
       return  t1==null ? t2==null : 
               (t2==null ? false : t1.getClass().equals(t2.getClass()) && Objects.equals(t1.getMessage(), t2.getMessage())
                    && Arrays.equals(t1.getStackTrace(), t2.getStackTrace()));
    };
    public final static BiPredicate<Throwable, Throwable> thowableEqual = (t1, t2) -> tEq.test(t1, t2) && tEq.test(t1.getCause(), t2.getCause());

    @Override
    public String getMessage() {
        return exceptions.size()+" error(s): "+exceptions.stream().map(p -> p.key+": "+p.value.getMessage()).collect(Collectors.joining(" | "));
    }

    public List<Pair<String, Throwable>> getExceptions() {
        return exceptions;
    }
    public boolean isEmpty() {
        return exceptions.isEmpty();
    }
}
